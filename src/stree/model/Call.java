package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A method call without arguments or with parenthesised ones, optionally on a receiver and
 * optionally with a block:
 * 
 * name, name(args), receiver.name(args) { |x| ... }, receiver&.name, Scope::name
 *
 */
public class Call extends Node {
	private final Node receiver;
	private final String operator;
	private final String name;
	private final Args arguments;
	private final Block block;

	public Call(SourceLocation location, Node receiver, String operator, String name, Args arguments, Block block) {
		super(location);
		this.receiver = receiver;
		this.operator = operator;
		this.name = name;
		this.arguments = arguments;
		this.block = block;
	}

	public Node getReceiver() {
		return receiver;
	}

	/**
	 * @return ".", "&." or "::" when there is a receiver, otherwise null
	 */
	public String getOperator() {
		return operator;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the parenthesised arguments, or null if the call has no parentheses
	 */
	public Args getArguments() {
		return arguments;
	}

	public Block getBlock() {
		return block;
	}

	@Override
	public String getType() {
		return "call";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("receiver", receiver);
		v.field("operator", operator);
		v.field("name", name);
		v.child("arguments", arguments);
		v.child("block", block);
	}

	@Override
	public void format(Formatter formatter) {
		if (receiver != null) {
			formatter.visit(receiver);
			formatter.text(operator);
		}
		formatter.text(name);
		if (arguments != null && (!arguments.getArguments().isEmpty() ||
				formatter.hasCommentsBefore(arguments.getLocation().getEndOffset()))) {
			formatter.visit(arguments);
		} else if (arguments != null && receiver == null && block == null) {
			// keeps a bare name with empty parentheses from reading as a local variable
			formatter.visit(arguments);
		}
		if (block != null) {
			formatter.visit(block);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Call call = (Call) o;
		return Objects.equals(receiver, call.receiver) &&
				Objects.equals(operator, call.operator) &&
				Objects.equals(name, call.name) &&
				Objects.equals(arguments, call.arguments) &&
				Objects.equals(block, call.block);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, operator, name, arguments, block);
	}
}
