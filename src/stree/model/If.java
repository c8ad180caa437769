package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A conditional statement. The keyword is one of if, unless or elsif; an elsif is the
 * alternative of the conditional before it and closes with that conditional's end.
 * 
 * if predicate
 *   consequent
 * elsif ...
 * else
 *   ...
 * end
 *
 */
public class If extends Node {
	private final String keyword;
	private final Node predicate;
	private final Statements consequent;
	private final Node alternative;

	public If(SourceLocation location, String keyword, Node predicate, Statements consequent, Node alternative) {
		super(location);
		this.keyword = keyword;
		this.predicate = predicate;
		this.consequent = consequent;
		this.alternative = alternative;
	}

	public String getKeyword() {
		return keyword;
	}

	public Node getPredicate() {
		return predicate;
	}

	public Statements getConsequent() {
		return consequent;
	}

	/**
	 * @return an elsif {@link If}, an {@link Else} or null
	 */
	public Node getAlternative() {
		return alternative;
	}

	@Override
	public String getType() {
		return keyword;
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("keyword", keyword);
		v.child("predicate", predicate);
		v.child("consequent", consequent);
		v.child("alternative", alternative);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text(keyword + " ");
			formatter.visit(predicate);
			Statements.formatBody(formatter, predicate.getLocation().getEndLine(), consequent);
			if (alternative != null) {
				formatter.hardline();
				formatter.visit(alternative);
			}
			if (!keyword.equals("elsif")) {
				formatter.hardline();
				formatter.text("end");
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		If that = (If) o;
		return Objects.equals(keyword, that.keyword) &&
				Objects.equals(predicate, that.predicate) &&
				Objects.equals(consequent, that.consequent) &&
				Objects.equals(alternative, that.alternative);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, predicate, consequent, alternative);
	}
}
