package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.Utils;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ops.IRContext;
import io.github.eutro.affineir.std.ModuleOp;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class AsmRoundTripTest {
    static void assertRoundTrips(ModuleOp module) throws ParseException {
        assertTrue(module.getOperation().verify().isSuccess(), () -> module.getOperation().verify().toString());
        String printed = AsmPrinter.printToString(module.getOperation());
        ModuleOp reparsed = Utils.parse(printed);
        assertTrue(reparsed.getOperation().verify().isSuccess());
        assertEquals(printed, AsmPrinter.printToString(reparsed.getOperation()));

        String generic = AsmPrinter.printToString(module.getOperation(), true);
        ModuleOp fromGeneric = Utils.parse(generic);
        assertEquals(generic, AsmPrinter.printToString(fromGeneric.getOperation(), true));
        assertEquals(printed, AsmPrinter.printToString(fromGeneric.getOperation()));
    }

    @Test
    void testLoops() throws IOException, ParseException {
        ModuleOp module = Utils.parseResource("/asm/loops.mlir");
        assertRoundTrips(module);
        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.startsWith("module {\n  func @copy(%arg0: memref<16x16xf32>, "
                + "%arg1: memref<16x16xf32, 2>, %arg2: index) {\n"), printed);
        assertTrue(printed.contains("affine.for %1 = 0 to 16 {"), printed);
        assertTrue(printed.contains(" to min affine_map<(d0)[s0] -> (d0 + 4, s0)>(%1)[%arg2] step 2 {"), printed);
        assertTrue(printed.contains("affine.load %arg0[%1, %2 + 1] : memref<16x16xf32>"), printed);
        assertTrue(printed.contains(", %arg1[%2, symbol(%arg2)] : memref<16x16xf32, 2>"), printed);
        assertTrue(printed.contains("} else {"), printed);
        assertFalse(printed.contains("affine.terminator"), printed);
        assertTrue(printed.contains("    return\n"), printed);
    }

    @Test
    void testDma() throws IOException, ParseException {
        ModuleOp module = Utils.parseResource("/asm/dma.mlir");
        assertRoundTrips(module);
        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.contains("affine.dma_start %arg0[%2 * 32], %arg1[0], %arg2[%0], %1 : "
                + "memref<256xf32>, memref<32xf32, 1>, memref<1xi32, 2>"), printed);
        assertTrue(printed.contains("affine.dma_wait %arg2[%0], %1 : memref<1xi32, 2>"), printed);
    }

    @Test
    void testSingleModuleIsNotWrapped() throws IOException, ParseException {
        ModuleOp module = Utils.parseResource("/asm/bounds.mlir");
        assertRoundTrips(module);
        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.startsWith("module {\n  func @bounds(%arg0: memref<?xf32>) -> index {\n"), printed);
        assertFalse(printed.contains("module {\n  module"), printed);
        assertTrue(printed.contains("dim %arg0, 0 : memref<?xf32>"), printed);
        assertTrue(printed.contains("affine.for %4 = max affine_map<()[s0, s1] -> (s0, s1)>()[%0, %1]"), printed);
        assertTrue(printed.contains("return %3 : index"), printed);
    }

    @Test
    void testGenericForm() throws ParseException {
        ModuleOp module = Utils.parse("func @f() {\n  %c = constant 3 : index\n  return\n}\n");
        String generic = AsmPrinter.printToString(module.getOperation(), true);
        assertTrue(generic.contains("\"std.constant\"() {value = 3 : index} : () -> index"), generic);
        assertTrue(generic.contains("\"std.return\"() : () -> ()"), generic);
        assertEquals(AsmPrinter.printToString(module.getOperation()),
                AsmPrinter.printToString(Utils.parse(generic).getOperation()));
    }

    @Test
    void testForwardReferences() throws ParseException {
        ModuleOp module = Utils.parse("func @f() -> index {\n"
                + "  %a = affine.apply affine_map<(d0) -> (d0 + 1)>(%b)\n"
                + "  %b = constant 1 : index\n"
                + "  return %a : index\n"
                + "}\n");
        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.contains("%0 = affine.apply affine_map<(d0) -> (d0 + 1)> (%1)"), printed);
        assertFalse(printed.contains("forward_ref"), printed);
        // the use precedes the definition in the same block
        assertTrue(module.getOperation().verify().isFailure());
    }

    @Test
    void testForwardReferenceTypeMismatch() {
        ParseException e = parseError("func @f() {\n"
                + "  %a = affine.apply affine_map<(d0) -> (d0 + 1)>(%b)\n"
                + "  %b = constant 1 : i32\n"
                + "  return\n"
                + "}\n");
        assertEquals("definition of SSA value '%b' has type i32 but was previously used with type index",
                e.getDiagnostic().getMessage());
    }

    static ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> Utils.parse(source));
    }

    @Test
    void testUnregisteredOpsRoundTrip() throws ParseException {
        ModuleOp module = Utils.parse("func @f(%n: index) -> index {\n"
                + "  %0 = \"foo.bar\"(%n) : (index) -> index\n"
                + "  return %0 : index\n"
                + "}\n");
        assertRoundTrips(module);
        String printed = AsmPrinter.printToString(module.getOperation());
        assertTrue(printed.contains("%0 = \"foo.bar\"(%arg0) : (index) -> index"), printed);
    }

    @Test
    void testErrors() {
        ParseException unknown = parseError("func @f() {\n  foo.bar\n}\n");
        assertEquals("custom op 'foo.bar' is unknown", unknown.getDiagnostic().getMessage());
        assertEquals(Location.fileLineCol("<test>", 2, 3), unknown.getLocation());

        IRContext strict = IRContext.withDefaultDialects().setAllowUnregisteredOps(false);
        ParseException unregistered = assertThrows(ParseException.class,
                () -> AsmParser.parseModule("\"foo.bar\"() : () -> ()", "<test>", strict));
        assertEquals("operation 'foo.bar' is not registered", unregistered.getDiagnostic().getMessage());

        assertEquals("use of undeclared SSA value name '%x'",
                parseError("func @f() -> index {\n  return %x : index\n}\n").getDiagnostic().getMessage());

        assertEquals("redefinition of SSA value '%c'",
                parseError("func @f() {\n  %c = constant 0 : index\n  %c = constant 1 : index\n  return\n}\n")
                        .getDiagnostic().getMessage());

        assertEquals("upper loop bound affine map with multiple results requires 'min' prefix",
                parseError("func @f(%n: index) {\n"
                        + "  affine.for %i = 0 to affine_map<()[s0] -> (s0, 10)>()[%n] {\n  }\n"
                        + "  return\n}\n").getDiagnostic().getMessage());

        assertEquals("expected step to be representable as a positive signed integer",
                parseError("func @f() {\n  affine.for %i = 0 to 10 step 0 {\n  }\n  return\n}\n")
                        .getDiagnostic().getMessage());
    }

    @Test
    void testCommentsAndWhitespace() throws ParseException {
        ModuleOp a = Utils.parse("// leading comment\nfunc @f() { // trailing\n  return\n}\n");
        ModuleOp b = Utils.parse("func @f() {\nreturn\n}");
        assertEquals(AsmPrinter.printToString(a.getOperation()), AsmPrinter.printToString(b.getOperation()));
    }
}
