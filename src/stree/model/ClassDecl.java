package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * class Name < Superclass
 *   body
 * end
 *
 */
public class ClassDecl extends Node {
	private final Node name;
	private final Node superclass;
	private final Statements body;

	public ClassDecl(SourceLocation location, Node name, Node superclass, Statements body) {
		super(location);
		this.name = name;
		this.superclass = superclass;
		this.body = body;
	}

	public Node getName() {
		return name;
	}

	public Node getSuperclass() {
		return superclass;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "class";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("name", name);
		v.child("superclass", superclass);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text("class ");
			formatter.visit(name);
			if (superclass != null) {
				formatter.text(" < ");
				formatter.visit(superclass);
			}
			Statements.formatBody(formatter, getLocation().getStartLine(), body);
			formatter.hardline();
			formatter.text("end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ClassDecl classDecl = (ClassDecl) o;
		return Objects.equals(name, classDecl.name) &&
				Objects.equals(superclass, classDecl.superclass) &&
				Objects.equals(body, classDecl.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, superclass, body);
	}
}
