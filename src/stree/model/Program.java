package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * The root of a parsed source file: its top-level statements and every comment found in it.
 *
 */
public class Program extends Node {
	private final Statements statements;
	private final List<Comment> comments;

	public Program(SourceLocation location, Statements statements, List<Comment> comments) {
		super(location);
		this.statements = statements;
		this.comments = Collections.unmodifiableList(comments);
	}

	public Statements getStatements() {
		return statements;
	}

	public List<Comment> getComments() {
		return comments;
	}

	@Override
	public String getType() {
		return "program";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("statements", statements);
	}

	@Override
	public void format(Formatter formatter) {
		if (statements.isEmpty() && !formatter.hasCommentsBefore(Integer.MAX_VALUE)) {
			return;
		}
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.visit(statements);
			formatter.hardline();
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Program program = (Program) o;
		return Objects.equals(statements, program.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}
}
