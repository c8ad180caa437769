package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * module Name
 *   body
 * end
 *
 */
public class ModuleDecl extends Node {
	private final Node name;
	private final Statements body;

	public ModuleDecl(SourceLocation location, Node name, Statements body) {
		super(location);
		this.name = name;
		this.body = body;
	}

	public Node getName() {
		return name;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "module";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("name", name);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text("module ");
			formatter.visit(name);
			Statements.formatBody(formatter, getLocation().getStartLine(), body);
			formatter.hardline();
			formatter.text("end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ModuleDecl that = (ModuleDecl) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, body);
	}
}
