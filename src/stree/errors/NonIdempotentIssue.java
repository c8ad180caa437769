package stree.errors;

import java.nio.file.Path;

/**
 * Formatting a file's formatted output changed it again.
 */
public class NonIdempotentIssue extends Issue {

	private static final long serialVersionUID = -8761208407788317011L;

	private final Path file;
	private final String firstPass;
	private final String secondPass;

	public NonIdempotentIssue(Path file, String firstPass, String secondPass) {
		this.file = file;
		this.firstPass = firstPass;
		this.secondPass = secondPass;
	}

	public Path getFile() {
		return file;
	}

	public String getFirstPass() {
		return firstPass;
	}

	public String getSecondPass() {
		return secondPass;
	}

	/**
	 * @return the 1-based number of the first line on which the two passes differ
	 */
	public int getFirstDifferingLine() {
		String[] first = firstPass.split("\n", -1);
		String[] second = secondPass.split("\n", -1);
		int i = 0;
		while (i < first.length && i < second.length && first[i].equals(second[i])) {
			++i;
		}
		return i + 1;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
