package stree.dump;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import static stree.model.NodeBuilder.*;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import stree.STree;
import stree.model.ArrayLiteral;
import stree.model.Node;
import stree.util.SourceLocation;

public class JsonDumperTest {

	@Test
	public void dumpsProgramWithLocationsAndComments() {
		JSONObject json = new JSONObject(JsonDumper.dump(STree.parse("x = 1 # set x\n")));
		assertThat(json.getString("type"), is("program"));

		JSONArray body = json.getJSONObject("statements").getJSONArray("body");
		assertThat(body.length(), is(1));
		JSONObject assign = body.getJSONObject(0);
		assertThat(assign.getString("type"), is("assign"));
		assertThat(assign.getString("operator"), is("="));
		assertThat(assign.getJSONObject("target").getString("value"), is("x"));
		assertThat(assign.getJSONObject("value").getString("value"), is("1"));

		JSONObject location = assign.getJSONObject("location");
		assertThat(location.getInt("start_line"), is(1));
		assertThat(location.getInt("start_column"), is(1));
		assertThat(location.getInt("end_column"), is(6));

		JSONArray comments = json.getJSONArray("comments");
		assertThat(comments.length(), is(1));
		assertThat(comments.getJSONObject(0).getString("value"), is("# set x"));
		assertTrue(comments.getJSONObject(0).getBoolean("inline"));
	}

	@Test
	public void absentChildrenAreNull() {
		JSONObject json = new JsonDumper().toJson(ret(null));
		assertTrue(json.isNull("value"));
		assertThat(json.getJSONObject("location").length(), is(0));
	}

	@Test
	public void marksCycles() {
		List<Node> elements = new ArrayList<>();
		ArrayLiteral array = new ArrayLiteral(SourceLocation.unknown(), elements);
		elements.add(array);
		JSONObject json = new JsonDumper().toJson(array);
		JSONObject inner = json.getJSONArray("elements").getJSONObject(0);
		assertThat(inner.getString("type"), is("array"));
		assertTrue(inner.getBoolean("cycle"));
	}
}
