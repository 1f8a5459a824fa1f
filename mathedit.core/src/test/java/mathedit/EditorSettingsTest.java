package mathedit;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class EditorSettingsTest {

  @Test
  public void defaults() {
    EditorSettings settings = new EditorSettings();
    assertThat(settings.historyLimit).isEqualTo(50);
    assertThat(settings.multiplySign).isEqualTo(EditorSettings.MULTIPLY_TIMES);
    assertThat(settings.reentryPadding).isEqualTo(15.0);
    assertThat(settings.siblingSwitchPadding).isEqualTo(5.0);
    assertThat(settings.exitInnerPadding).isEqualTo(2.0);
    assertThat(settings.handleYOffset).isEqualTo(30.0);
    assertThat(settings.boundVariable).isEqualTo("x");
  }

  @Test
  public void loadsBundledProperties() {
    EditorSettings settings = EditorSettings.load();
    assertThat(settings.historyLimit).isEqualTo(50);
    assertThat(settings.multiplySign).isEqualTo("×");
    assertThat(settings.boundVariable).isEqualTo("x");
  }

  @Test
  public void readsProperties() {
    Properties properties = new Properties();
    properties.setProperty("mathedit.history.limit", "7");
    properties.setProperty("mathedit.multiply.sign", "·");
    properties.setProperty("mathedit.drag.handleYOffset", "12.5");
    properties.setProperty("mathedit.sum.variable", "n");
    EditorSettings settings = EditorSettings.fromProperties(properties);
    assertThat(settings.historyLimit).isEqualTo(7);
    assertThat(settings.multiplyChar()).isEqualTo('·');
    assertThat(settings.handleYOffset).isEqualTo(12.5);
    assertThat(settings.boundVariable).isEqualTo("n");
    assertThat(settings.reentryPadding).isEqualTo(15.0);
  }

  @Test
  public void malformedValuesFallBack() {
    Properties properties = new Properties();
    properties.setProperty("mathedit.history.limit", "lots");
    properties.setProperty("mathedit.multiply.sign", "x");
    properties.setProperty("mathedit.drag.reentryPadding", "-3");
    EditorSettings settings = EditorSettings.fromProperties(properties);
    assertThat(settings.historyLimit).isEqualTo(50);
    assertThat(settings.multiplySign).isEqualTo(EditorSettings.MULTIPLY_TIMES);
    assertThat(settings.reentryPadding).isEqualTo(15.0);
  }

  @Test
  public void copiesWithChanges() {
    EditorSettings settings = new EditorSettings().withHistoryLimit(4).withMultiplySign(EditorSettings.MULTIPLY_DOT);
    assertThat(settings.historyLimit).isEqualTo(4);
    assertThat(settings.multiplySign).isEqualTo("·");
  }
}
