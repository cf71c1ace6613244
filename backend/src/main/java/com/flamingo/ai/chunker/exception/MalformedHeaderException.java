package com.flamingo.ai.chunker.exception;

/**
 * Exception thrown when a header table exists but lacks an expected row or cell.
 *
 * <p>This is a soft failure: metadata extraction catches it per field and degrades the field to
 * an empty string.
 */
public class MalformedHeaderException extends RuntimeException {

  private final int row;
  private final int cell;

  public MalformedHeaderException(int row, int cell) {
    super("Header table has no cell at row " + row + ", index " + cell);
    this.row = row;
    this.cell = cell;
  }

  public int getRow() {
    return row;
  }

  public int getCell() {
    return cell;
  }
}
