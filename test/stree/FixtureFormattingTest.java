package stree;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Every file under test/fixtures is already in canonical layout and must come back unchanged.
 */
@RunWith(Parameterized.class)
public class FixtureFormattingTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		List<Object[]> fixtures = new ArrayList<>();
		for (File file : FileUtils.listFiles(new File("test", "fixtures"), new String[] {"rb"}, true)) {
			fixtures.add(new Object[] {file.getName(), file});
		}
		return fixtures;
	}

	private final File file;

	public FixtureFormattingTest(String name, File file) {
		this.file = file;
	}

	@Test
	public void formatsUnchanged() throws IOException {
		String source = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		assertThat(STree.format(source), is(source));
	}

	@Test
	public void reparsesToSameTree() throws IOException {
		String source = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		assertEquals(STree.parse(source), STree.parse(STree.format(source)));
	}
}
