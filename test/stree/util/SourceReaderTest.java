package stree.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SourceReaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void readsUtf8ByDefault() throws IOException {
		File file = folder.newFile("a.rb");
		FileUtils.writeStringToFile(file, "puts \"héllo\"\n", StandardCharsets.UTF_8);
		assertThat(SourceReader.read(file.toPath()), is("puts \"héllo\"\n"));
	}

	@Test
	public void honoursMagicComment() throws IOException {
		File file = folder.newFile("latin.rb");
		FileUtils.writeStringToFile(file, "# encoding: ISO-8859-1\nputs \"café\"\n", StandardCharsets.ISO_8859_1);
		assertThat(SourceReader.read(file.toPath()), is("# encoding: ISO-8859-1\nputs \"café\"\n"));
	}

	@Test
	public void magicCommentAfterShebang() throws IOException {
		byte[] bytes = "#!/usr/bin/env ruby\n# -*- coding: iso-8859-1 -*-\n".getBytes(StandardCharsets.ISO_8859_1);
		assertThat(SourceReader.detectEncoding(bytes), is(StandardCharsets.ISO_8859_1));
	}

	@Test
	public void magicCommentOnlyOnFirstLines() throws IOException {
		byte[] bytes = "x = 1\n# encoding: ISO-8859-1\n".getBytes(StandardCharsets.ISO_8859_1);
		assertThat(SourceReader.detectEncoding(bytes), is(StandardCharsets.UTF_8));
	}

	@Test
	public void skipsByteOrderMark() throws IOException {
		File file = folder.newFile("bom.rb");
		byte[] body = "x = 1\n".getBytes(StandardCharsets.UTF_8);
		byte[] bytes = new byte[body.length + 3];
		bytes[0] = (byte) 0xEF;
		bytes[1] = (byte) 0xBB;
		bytes[2] = (byte) 0xBF;
		System.arraycopy(body, 0, bytes, 3, body.length);
		FileUtils.writeByteArrayToFile(file, bytes);
		assertThat(SourceReader.read(file.toPath()), is("x = 1\n"));
	}

	@Test(expected = IOException.class)
	public void unknownEncoding() throws IOException {
		SourceReader.detectEncoding("# encoding: no-such-charset\n".getBytes(StandardCharsets.US_ASCII));
	}
}
