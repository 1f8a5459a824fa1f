package mathedit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class EditorSettings {
  private static final Logger logger = LogManager.getLogger(EditorSettings.class);

  public static final String RESOURCE = "/mathedit.properties";
  public static final String MULTIPLY_TIMES = "×";
  public static final String MULTIPLY_DOT = "·";

  public final int historyLimit;
  public final String multiplySign;
  public final double reentryPadding;
  public final double siblingSwitchPadding;
  public final double exitInnerPadding;
  public final double handleYOffset;
  public final String boundVariable;

  public EditorSettings() {
    this(0, null);
  }

  public EditorSettings(int historyLimit) {
    this(historyLimit, null);
  }

  public EditorSettings(int historyLimit, String multiplySign) {
    this(historyLimit, multiplySign, -1, -1, -1, -1, null);
  }

  public EditorSettings(int historyLimit,
                        String multiplySign,
                        double reentryPadding,
                        double siblingSwitchPadding,
                        double exitInnerPadding,
                        double handleYOffset,
                        String boundVariable) {
    if (historyLimit <= 0) {
      historyLimit = 50;
    }
    if (!MULTIPLY_TIMES.equals(multiplySign) && !MULTIPLY_DOT.equals(multiplySign)) {
      multiplySign = MULTIPLY_TIMES;
    }
    if (reentryPadding < 0) {
      reentryPadding = 15;
    }
    if (siblingSwitchPadding < 0) {
      siblingSwitchPadding = 5;
    }
    if (exitInnerPadding < 0) {
      exitInnerPadding = 2;
    }
    if (handleYOffset < 0) {
      handleYOffset = 30;
    }
    if (boundVariable == null || boundVariable.isEmpty()) {
      boundVariable = "x";
    }
    this.historyLimit = historyLimit;
    this.multiplySign = multiplySign;
    this.reentryPadding = reentryPadding;
    this.siblingSwitchPadding = siblingSwitchPadding;
    this.exitInnerPadding = exitInnerPadding;
    this.handleYOffset = handleYOffset;
    this.boundVariable = boundVariable;
  }

  public static EditorSettings fromProperties(Properties properties) {
    return new EditorSettings(intValue(properties, "mathedit.history.limit"),
                              properties.getProperty("mathedit.multiply.sign"),
                              doubleValue(properties, "mathedit.drag.reentryPadding"),
                              doubleValue(properties, "mathedit.drag.siblingSwitchPadding"),
                              doubleValue(properties, "mathedit.drag.exitInnerPadding"),
                              doubleValue(properties, "mathedit.drag.handleYOffset"),
                              properties.getProperty("mathedit.sum.variable"));
  }

  /**
   * Reads {@value #RESOURCE} from the classpath, falling back to defaults when it is missing or unreadable.
   */
  public static EditorSettings load() {
    Properties properties = new Properties();
    try (InputStream in = EditorSettings.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        logger.debug("{} not found, using defaults", RESOURCE);
        return new EditorSettings();
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        properties.load(reader);
      }
    }
    catch (IOException e) {
      logger.warn("Failed to read {}, using defaults", RESOURCE, e);
      return new EditorSettings();
    }
    return fromProperties(properties);
  }

  public EditorSettings withMultiplySign(String multiplySign) {
    return new EditorSettings(historyLimit, multiplySign, reentryPadding, siblingSwitchPadding, exitInnerPadding, handleYOffset, boundVariable);
  }

  public EditorSettings withHistoryLimit(int historyLimit) {
    return new EditorSettings(historyLimit, multiplySign, reentryPadding, siblingSwitchPadding, exitInnerPadding, handleYOffset, boundVariable);
  }

  public char multiplyChar() {
    return multiplySign.charAt(0);
  }

  private static int intValue(Properties properties, String key) {
    String value = properties.getProperty(key);
    if (value == null) return 0;
    try {
      return Integer.parseInt(value.trim());
    }
    catch (NumberFormatException e) {
      logger.warn("Ignoring malformed {}={}", key, value);
      return 0;
    }
  }

  private static double doubleValue(Properties properties, String key) {
    String value = properties.getProperty(key);
    if (value == null) return -1;
    try {
      return Double.parseDouble(value.trim());
    }
    catch (NumberFormatException e) {
      logger.warn("Ignoring malformed {}={}", key, value);
      return -1;
    }
  }

  @Override
  public String toString() {
    return "EditorSettings{" +
           "historyLimit=" + historyLimit +
           ", multiplySign=" + multiplySign +
           ", reentryPadding=" + reentryPadding +
           ", siblingSwitchPadding=" + siblingSwitchPadding +
           ", exitInnerPadding=" + exitInnerPadding +
           ", handleYOffset=" + handleYOffset +
           ", boundVariable=" + boundVariable +
           '}';
  }
}
