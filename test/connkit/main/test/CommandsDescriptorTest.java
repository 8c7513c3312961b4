package connkit.main.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import junit.framework.TestCase;
import connkit.graphs.ConnectedComponentsFinder;
import connkit.graphs.DisjointSetsMerger;
import connkit.main.Command;
import connkit.main.CommandOption;
import connkit.main.CommandsDescriptor;
import connkit.main.io.ParseUtils;

public class CommandsDescriptorTest extends TestCase {

	public void testLoadDescriptor() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		assertEquals("1.0.0", descriptor.getSwVersion());
		Command components = descriptor.getCommand("Components");
		assertNotNull(components);
		assertEquals(ConnectedComponentsFinder.class, components.getProgram());
		assertEquals(1, components.getArguments().size());
		CommandOption n = components.getOption("n");
		assertEquals(CommandOption.TYPE_INT, n.getType());
		assertEquals("numVertices", n.getAttribute());
		Command merge = descriptor.getCommandByClass(DisjointSetsMerger.class.getName());
		assertEquals("MergeSets", merge.getId());
		assertEquals(2, merge.getArguments().size());
		assertEquals(4, merge.getOptionsList().size());
		assertTrue(merge.getOption("w").isBoolean());
		assertNull(descriptor.getCommand("Unknown"));
	}

	public void testPrintHelp() throws UnsupportedEncodingException {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		CommandsDescriptor.getInstance().printHelp(DisjointSetsMerger.class, new PrintStream(os, true, "UTF-8"));
		String help = os.toString("UTF-8");
		assertTrue(help.contains("MergeSets"));
		assertTrue(help.contains("-c COMPRESSION"));
		assertTrue(help.contains("<UNIONS_FILE>"));
		os = new ByteArrayOutputStream();
		CommandsDescriptor.getInstance().printUsage(new PrintStream(os, true, "UTF-8"));
		assertTrue(os.toString("UTF-8").contains("> Components"));
	}

	public void testDecodeOptions() {
		DisjointSetsMerger merger = new DisjointSetsMerger();
		int next = CommandsDescriptor.getInstance().decodeOptions(merger, new String[] {"-d", "-b", "5", "-", "unions.txt"});
		assertEquals(3, next);
		assertTrue(merger.isNoCompression());
		assertEquals(5, merger.getBatchSize());
		try {
			CommandsDescriptor.getInstance().decodeOptions(merger, new String[] {"-b"});
			fail("Options without value should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			CommandsDescriptor.getInstance().decodeOptions(merger, new String[] {"-b", "five", "a", "b"});
			fail("Non numeric values should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testParseIntegers() {
		int [] values = ParseUtils.parseIntegers(" 3\t4  5 ");
		assertEquals(3, values.length);
		assertEquals(3, values[0]);
		assertEquals(5, values[2]);
		assertEquals(0, ParseUtils.parseIntegers("").length);
		assertEquals(4, ParseUtils.parseString("a b\tc ", '\t', ' ').length);
	}
}
