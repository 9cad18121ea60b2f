package org.trypticon.fstkit;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.trypticon.fstkit.constfst.ConstFst;
import org.trypticon.fstkit.constfst.ConstFstCodec;
import org.trypticon.fstkit.properties.FstProperties;
import org.trypticon.fstkit.vector.VectorFst;
import org.trypticon.fstkit.vector.VectorFstCodec;
import org.trypticon.fstkit.weight.LogArcType;
import org.trypticon.fstkit.weight.TropicalWeight;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.trypticon.fstkit.TestFsts.STD;
import static org.trypticon.fstkit.TestFsts.assertSameStructure;
import static org.trypticon.fstkit.TestFsts.fromBytes;
import static org.trypticon.fstkit.TestFsts.symbols;
import static org.trypticon.fstkit.TestFsts.toBytes;
import static org.trypticon.fstkit.TestFsts.unsortedDag;

/**
 * Tests for {@link FstClass}.
 */
public class FstClassTests {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private Path temp;
    private RecordingInfoStream infoStream;
    private FstConfig config;

    @Before
    public void setUp() {
        temp = folder.getRoot().toPath();
        infoStream = new RecordingInfoStream();
        config = FstConfig.builder().setInfoStream(infoStream).build();
    }

    @Test
    public void testWrap() {
        assertThat(FstClass.wrap(unsortedDag(config), config), is(instanceOf(MutableFstClass.class)));
        assertThat(FstClass.wrap(ConstFst.copyOf(unsortedDag(config), config), config),
                is(not(instanceOf(MutableFstClass.class))));
    }

    @Test
    public void testAccessors() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.setInputSymbols(symbols("in", "a"));
        FstClass handle = new FstClass(fst, config);
        assertThat(handle.fstType(), is("vector"));
        assertThat(handle.arcType(), is("standard"));
        assertThat(handle.weightType(), is("tropical"));
        assertThat(handle.start(), is(3));
        assertThat(handle.numStates(), is(4));
        assertThat(handle.numArcs(3), is(2));
        assertThat(handle.finalWeight(0), is((Weight) TestFsts.w(2f)));
        assertThat(handle.arcs(2).size(), is(1));
        assertThat(handle.inputSymbols(), is(fst.inputSymbols()));
        assertThat(handle.outputSymbols(), is(nullValue()));
        assertThat(handle.properties(FstProperties.MUTABLE, false), is(FstProperties.MUTABLE));
        assertThat(handle.getFst(), is(sameInstance(fst)));
        assertThat(handle.getConfig(), is(sameInstance(config)));
    }

    @Test
    public void testGetFst_ArcType() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        FstClass handle = new FstClass(fst, config);
        assertThat(handle.getFst(STD), is(sameInstance(fst)));
        assertThat(handle.getFst(new LogArcType()), is(nullValue()));
    }

    @Test
    public void testWriteRead_Vector() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.setOutputSymbols(symbols("out", "x", "y"));
        FstClass read = fromBytes(toBytes(new FstClass(fst, config)), config);
        assertThat(read, is(instanceOf(MutableFstClass.class)));
        assertThat(read.fstType(), is("vector"));
        assertSameStructure(fst, read.getFst());
        assertThat(read.outputSymbols(), is(fst.outputSymbols()));
        assertThat(infoStream.getMessages().isEmpty(), is(true));
    }

    @Test
    public void testWriteRead_Const() {
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(unsortedDag(config), config);
        FstClass read = fromBytes(toBytes(new FstClass(fst, config)), config);
        assertThat(read, is(not(instanceOf(MutableFstClass.class))));
        assertThat(read.fstType(), is("const"));
        assertSameStructure(fst, read.getFst());
    }

    @Test
    public void testWriteRead_File() {
        Path file = temp.resolve("test.fst");
        FstClass fst = new FstClass(unsortedDag(config), config);
        assertThat(fst.write(file), is(true));
        FstClass read = FstClass.read(file, config);
        assertThat(read, is(notNullValue()));
        assertSameStructure(fst.getFst(), read.getFst());
    }

    @Test
    public void testRead_FileMapped_VectorIsCopied() {
        FstConfig mapping = config.toBuilder().setReadMode(FileReadMode.MAP).build();
        Path file = temp.resolve("vector.fst");
        assertThat(new FstClass(unsortedDag(config), config).write(file), is(true));

        FstClass read = FstClass.read(file, mapping);
        assertThat(read, is(instanceOf(MutableFstClass.class)));
        assertSameStructure(unsortedDag(config), read.getFst());
        // the file can be replaced once read
        assertThat(new FstClass(TestFsts.cycle(config), config).write(file), is(true));
        assertSameStructure(unsortedDag(config), read.getFst());
        assertThat(infoStream.getMessages().isEmpty(), is(true));
    }

    @Test
    public void testRead_Stream() {
        byte[] bytes = toBytes(new FstClass(unsortedDag(config), config));
        FstClass read = FstClass.read(new ByteArrayInputStream(bytes), "standard input", config);
        assertSameStructure(unsortedDag(config), read.getFst());
    }

    @Test
    public void testRead_MissingFile() {
        Path file = temp.resolve("missing.fst");
        assertThat(FstClass.read(file, config), is(nullValue()));
        assertThat(infoStream.getMessages(), is(List.of("FstClass: Could not open file: " + file + ": " + file)));
    }

    @Test
    public void testRead_UnknownFstType() throws Exception {
        assertThat(fromBytes(headerOnly("compact", "standard"), config), is(nullValue()));
        assertThat(infoStream.getMessages(),
                is(List.of("FstClass: Unknown FST type \"compact\" (arc type = \"standard\"): test")));
    }

    @Test
    public void testRead_UnknownArcType() throws Exception {
        assertThat(fromBytes(headerOnly("vector", "gallic"), config), is(nullValue()));
        assertThat(infoStream.getMessages(), is(List.of("FstClass: Unknown arc type \"gallic\": test")));
    }

    @Test
    public void testRead_NotRegistered() {
        FstRegistry registry = FstRegistry.builder().register(new VectorFstCodec()).register(STD).build();
        FstConfig limited = config.toBuilder().setRegistry(registry).build();
        byte[] bytes = toBytes(new FstClass(ConstFst.copyOf(unsortedDag(config), config), config));
        assertThat(fromBytes(bytes, limited), is(nullValue()));
        assertThat(infoStream.getMessages(),
                is(List.of("FstClass: Unknown FST type \"const\" (arc type = \"standard\"): test")));
    }

    @Test
    public void testRead_BadMagic() {
        assertThat(fromBytes(new byte[] { 1, 2, 3, 4, 5 }, config), is(nullValue()));
        assertThat(infoStream.getMessages(),
                is(List.of("FstHeader: Bad FST header: test. Magic number not matched. Got: 67305985")));
    }

    @Test
    public void testRead_Truncated() {
        byte[] bytes = toBytes(new FstClass(unsortedDag(config), config));
        byte[] truncated = new byte[bytes.length - 3];
        System.arraycopy(bytes, 0, truncated, 0, truncated.length);
        assertThat(fromBytes(truncated, config), is(nullValue()));
        assertThat(infoStream.getMessages().size(), is(1));
        assertThat(infoStream.getMessages().get(0), startsWith("FstClass: Read failed: "));
    }

    @Test
    public void testRead_VerifyFails() {
        byte[] bytes = toBytes(new FstClass(ConstFst.copyOf(unsortedDag(config), config), config));
        // last four bytes are the destination of the final arc
        bytes[bytes.length - 4] = 9;
        assertThat(fromBytes(bytes, config), is(nullValue()));
        assertThat(infoStream.getMessages(), is(List.of(
                "Verify: FST destination state ID of arc at position 1 of state 3 exceeds number of states",
                "FstClass: Verify failed: test")));
    }

    @Test
    public void testRead_ExternalSymbols() {
        VectorFst<TropicalWeight> fst = unsortedDag(config);
        fst.setInputSymbols(symbols("in", "a"));
        SymbolTable external = symbols("external", "p", "q");
        FstReadOptions options = new FstReadOptions("test", FileReadMode.READ, null, external, null);

        FstClass read = FstClass.read(Utils.input(toBytes(new FstClass(fst, config))), options, config);
        assertThat(read.inputSymbols(), is(external));
        assertThat(read.inputSymbols(), is(not(sameInstance(external))));
        assertThat(read.outputSymbols(), is(nullValue()));
    }

    @Test
    public void testWrite_UnknownType() {
        FstRegistry registry = FstRegistry.builder().register(new ConstFstCodec()).register(STD).build();
        FstConfig limited = config.toBuilder().setRegistry(registry).build();
        FstClass fst = new FstClass(unsortedDag(config), limited);
        assertThat(fst.write(temp.resolve("test.fst")), is(false));
        assertThat(infoStream.getMessages(), is(List.of("FstClass: Unknown FST type \"vector\": " +
                temp.resolve("test.fst"))));
    }

    private static byte[] headerOnly(String fstType, String arcType) throws Exception {
        FstHeader header = new FstHeader();
        header.setFstType(fstType);
        header.setArcType(arcType);
        header.setVersion(2);
        return TestFsts.toBytes(header);
    }
}
