package stree.errors;

import java.nio.file.Path;

/**
 * A checked file differs from its formatted form.
 */
public class UnformattedFileIssue extends Issue {

	private static final long serialVersionUID = 7147839779453920118L;

	private final Path file;

	public UnformattedFileIssue(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
