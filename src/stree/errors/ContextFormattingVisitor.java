package stree.errors;

import stree.layout.IndentingWriter;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileProcessingFile whileProcessingFile) throws IOException {
		out.write("while processing ");
		out.write(whileProcessingFile.getFile().toString());
		return null;
	}

}
