package edu.tum.cs.matrix;

/**
 * Signals a write or read-modify-write to a cell that is not stored in a matrix.
 */
public class MatrixIndexException extends Exception {

	private static final long serialVersionUID = 4617702358214479305L;

	private final int row;
	private final int column;

	public MatrixIndexException(int row, int column) {
		super("index out of bounds");
		this.row = row;
		this.column = column;
	}

	public int getRow() {
		return row;
	}

	public int getColumn() {
		return column;
	}

}
