package stree.dump;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static stree.model.NodeBuilder.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import stree.STree;
import stree.model.ArrayLiteral;
import stree.model.Node;
import stree.util.SourceLocation;

public class StructureDumperTest {

	@Test
	public void dumpsNodeAsSExpression() {
		assertThat(assign(var("x"), "=", num(1)).toString(), is("(assign (var_ref \"x\") \"=\" (number \"1\"))"));
	}

	@Test
	public void skipsAbsentChildren() {
		assertThat(ret(null).toString(), is("(return)"));
	}

	@Test
	public void dumpsParsedProgram() {
		assertThat(StructureDumper.dump(STree.parse("foo(1)"), 80),
				is("(program (statements [(call \"foo\" (args [(number \"1\")]))]))"));
	}

	@Test
	public void breaksWhenNarrow() {
		String dump = StructureDumper.dump(def("foo", params(param("a")), var("a")), 40);
		assertThat(dump, is("(def\n  \"foo\"\n  (params [(param REQUIRED \"a\")])\n  (statements [(var_ref \"a\")]))"));
	}

	@Test
	public void dumpsListsAndScalars() {
		assertThat(StructureDumper.dump(Arrays.asList("a\"b", 1, null), 80), is("[\"a\\\"b\", 1, nil]"));
		assertThat(StructureDumper.dump(new ArrayList<>(), 80), is("[]"));
	}

	@Test
	public void guardsAgainstCycles() {
		List<Node> elements = new ArrayList<>();
		ArrayLiteral array = new ArrayLiteral(SourceLocation.unknown(), elements);
		elements.add(num(1));
		elements.add(array);
		assertThat(array.toString(), is("(array [(number \"1\"), " + StructureDumper.CYCLE + "])"));
	}

	@Test
	public void guardsAgainstSelfContainingLists() {
		List<Object> list = new ArrayList<>();
		list.add("x");
		list.add(list);
		assertThat(StructureDumper.dump(list, 80), is("[\"x\", ...]"));
	}

	@Test
	public void sharedButAcyclicValuesAreDumpedTwice() {
		Node shared = num(7);
		assertThat(StructureDumper.dump(Arrays.asList(shared, shared), 80), is("[(number \"7\"), (number \"7\")]"));
	}
}
