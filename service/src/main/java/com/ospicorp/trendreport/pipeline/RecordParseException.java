package com.ospicorp.trendreport.pipeline;

public class RecordParseException extends RuntimeException {
  private final long rowNumber;
  private final String column;

  public RecordParseException(String message, long rowNumber, String column) {
    super(describe(message, rowNumber, column));
    this.rowNumber = rowNumber;
    this.column = column;
  }

  public RecordParseException(String message, long rowNumber, String column, Throwable cause) {
    super(describe(message, rowNumber, column), cause);
    this.rowNumber = rowNumber;
    this.column = column;
  }

  // 0 means the header row
  public long rowNumber() {
    return rowNumber;
  }

  public String column() {
    return column;
  }

  private static String describe(String message, long rowNumber, String column) {
    String location = rowNumber == 0 ? "header" : "row " + rowNumber;
    if (column != null) {
      location += ", column " + column;
    }
    return message + " (" + location + ")";
  }
}
