package io.b2mash.b2b.backoffice.frequency;

/** Raised when a schedule date argument is missing or is not an ISO-8601 calendar date. */
public class InvalidScheduleDateException extends IllegalArgumentException {

  private final String argument;
  private final String value;

  public InvalidScheduleDateException(String argument, String value) {
    super(message(argument, value));
    this.argument = argument;
    this.value = value;
  }

  public InvalidScheduleDateException(String argument, String value, Throwable cause) {
    super(message(argument, value), cause);
    this.argument = argument;
    this.value = value;
  }

  private InvalidScheduleDateException(
      String argument, String value, String message, Throwable cause) {
    super(message, cause);
    this.argument = argument;
    this.value = value;
  }

  /** The date is valid but the next occurrence after it falls outside the supported range. */
  public static InvalidScheduleDateException outOfRange(
      String argument, String value, Throwable cause) {
    return new InvalidScheduleDateException(
        argument,
        value,
        "Invalid " + argument + ": '" + value + "' is outside the supported date range",
        cause);
  }

  public String getArgument() {
    return argument;
  }

  public String getValue() {
    return value;
  }

  private static String message(String argument, String value) {
    return value == null
        ? "Missing " + argument
        : "Invalid " + argument + ": '" + value + "' is not a valid date (expected yyyy-MM-dd)";
  }
}
