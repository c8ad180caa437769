package stree.errors;

import java.nio.file.Path;

public class WhileProcessingFile extends Context {

	private final Path file;

	public WhileProcessingFile(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
