package mathedit.nodes;

public final class Slots {
  public static final String NUMERATOR = "num";
  public static final String DENOMINATOR = "den";
  public static final String BASE = "base";
  public static final String POWER = "pow";
  public static final String INDEX = "index";
  public static final String RADICAND = "radicand";
  public static final String ARGUMENT = "arg";
  public static final String CONTENT = "content";
  public static final String N = "n";
  public static final String R = "r";
  public static final String VARIABLE = "var";
  public static final String LOWER = "lower";
  public static final String UPPER = "upper";
  public static final String BODY = "body";
  public static final String AT = "at";

  private Slots() {
  }
}
