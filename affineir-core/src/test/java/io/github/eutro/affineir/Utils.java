package io.github.eutro.affineir;

import io.github.eutro.affineir.asm.AsmParser;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ops.IRContext;
import io.github.eutro.affineir.std.FuncOp;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.std.ReturnOp;
import io.github.eutro.affineir.types.FunctionType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class Utils {
    public static final Location LOC = Location.unknown();

    public static IRContext context() {
        return IRContext.withDefaultDialects();
    }

    @NotNull
    public static String readResource(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static ModuleOp parseResource(String name) throws IOException, ParseException {
        return AsmParser.parseModule(readResource(name), name, context());
    }

    public static ModuleOp parse(String source) throws ParseException {
        return AsmParser.parseModule(source, "<test>", context());
    }

    /**
     * Add a function to a module, with an entry block that returns nothing.
     *
     * @return A builder inserting before the return.
     */
    public static OpBuilder addFunction(ModuleOp module, String name, List<Type> inputs) {
        context();
        FuncOp func = FuncOp.create(LOC, name, FunctionType.get(inputs, List.of()));
        module.push(func.getOperation());
        Block entry = func.addEntryBlock();
        OpBuilder builder = OpBuilder.atBlockEnd(entry);
        ReturnOp ret = ReturnOp.create(builder, LOC, List.of());
        return OpBuilder.before(ret.getOperation());
    }

    public static Block entryBlock(OpBuilder builder) {
        Block block = builder.getInsertionBlock();
        if (block == null) throw new IllegalStateException("builder has no insertion point");
        return block;
    }
}
