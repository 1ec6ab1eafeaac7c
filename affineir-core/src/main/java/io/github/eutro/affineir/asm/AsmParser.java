package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.affine.expr.AffineExpr;
import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.attrs.AffineMapAttr;
import io.github.eutro.affineir.attrs.ArrayAttr;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.FloatAttr;
import io.github.eutro.affineir.attrs.IntegerAttr;
import io.github.eutro.affineir.attrs.IntegerSetAttr;
import io.github.eutro.affineir.attrs.StringAttr;
import io.github.eutro.affineir.attrs.TypeAttr;
import io.github.eutro.affineir.attrs.UnitAttr;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.IRContext;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.ops.OpParser;
import io.github.eutro.affineir.std.BuiltinOps;
import io.github.eutro.affineir.std.ModuleOp;
import io.github.eutro.affineir.types.FloatType;
import io.github.eutro.affineir.types.FunctionType;
import io.github.eutro.affineir.types.IndexType;
import io.github.eutro.affineir.types.IntegerType;
import io.github.eutro.affineir.types.MemRefType;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads the text written by {@link AsmPrinter}, in either the custom or the generic form.
 * <p>
 * Values may be used before they are defined; such uses are bound to placeholders
 * that are replaced when the definition is read. Value and block names are scoped to the region they are defined in.
 * <p>
 * The parser does not verify what it reads. If reading fails, every operation created so far
 * has its references dropped, and nothing is left attached to anything else.
 */
public final class AsmParser implements OpAsmParser {
    private static final Logger LOGGER = Logger.getLogger(AsmParser.class.getName());
    private static final OpKey FORWARD_REF = OpKey.unregistered("builtin.forward_ref");
    private static final Map<String, Token.Kind> PUNCTUATION = new HashMap<>();

    static {
        for (Token.Kind kind : Token.Kind.values()) {
            if (kind.spelling != null) PUNCTUATION.put(kind.spelling, kind);
        }
    }

    private static final class Scope {
        final Map<String, Value> values = new HashMap<>();
        final Map<String, Value> forwardRefs = new LinkedHashMap<>();
        final Map<String, Location> forwardRefLocs = new HashMap<>();
        final Map<String, Block> blocks = new LinkedHashMap<>();
        final Map<String, Location> blockRefLocs = new HashMap<>();
        final Set<String> definedBlocks = new HashSet<>();
    }

    @FunctionalInterface
    private interface AtomParser {
        @Nullable AffineExpr parse() throws ParseException;
    }

    private final Lexer lexer;
    private final IRContext context;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final List<Operation> created = new ArrayList<>();
    private Token tok;

    private AsmParser(String source, String fileName, IRContext context) throws ParseException {
        this.lexer = new Lexer(source, fileName);
        this.context = context;
        this.tok = lexer.lex();
    }

    /**
     * Read a module. The text may be a single {@code module} operation, or a list of operations
     * that is wrapped in a new module.
     *
     * @param source   The text.
     * @param fileName The name used in locations.
     * @param context  The known dialects.
     * @return The module.
     * @throws ParseException If the text is malformed.
     */
    public static ModuleOp parseModule(String source, String fileName, IRContext context) throws ParseException {
        List<Operation> ops = parseOperations(source, fileName, context);
        if (ops.size() == 1 && ops.get(0).getKey() == BuiltinOps.MODULE) {
            return ModuleOp.cast(ops.get(0));
        }
        ModuleOp module = ModuleOp.create(ops.isEmpty()
                ? Location.fileLineCol(fileName, 1, 1)
                : ops.get(0).getLoc());
        for (Operation op : ops) {
            module.push(op);
        }
        return module;
    }

    /**
     * Read a list of top level operations.
     *
     * @param source   The text.
     * @param fileName The name used in locations.
     * @param context  The known dialects.
     * @return The operations, in no block.
     * @throws ParseException If the text is malformed.
     */
    public static List<Operation> parseOperations(String source, String fileName, IRContext context)
            throws ParseException {
        AsmParser parser = new AsmParser(source, fileName, context);
        try {
            List<Operation> ops = parser.parseTopLevel();
            LOGGER.fine(() -> "read " + parser.created.size() + " operations from " + fileName);
            return ops;
        } catch (ParseException e) {
            parser.tearDown();
            throw e;
        }
    }

    private List<Operation> parseTopLevel() throws ParseException {
        scopes.push(new Scope());
        List<Operation> ops = new ArrayList<>();
        while (!tok.is(Token.Kind.EOF)) {
            ops.add(parseOperation());
        }
        popScope();
        return ops;
    }

    private void tearDown() {
        for (Operation op : created) {
            op.dropAllReferences();
        }
        created.clear();
    }

    // tokens

    private void consume() throws ParseException {
        tok = lexer.lex();
    }

    private void resetTo(Token token) throws ParseException {
        lexer.resetTo(token);
        tok = lexer.lex();
    }

    private ParseException errorAt(Token token, String message) {
        return new ParseException(lexer.locationOf(token), message);
    }

    @Override
    public Location getCurrentLocation() {
        return lexer.locationOf(tok);
    }

    @Override
    public ParseException error(String message) {
        return errorAt(tok, message);
    }

    @Override
    public boolean parseOptionalKeyword(String keyword) throws ParseException {
        if (!tok.isKeyword(keyword)) return false;
        consume();
        return true;
    }

    @Override
    public void parseKeyword(String keyword) throws ParseException {
        if (!tok.isKeyword(keyword)) throw error("expected '" + keyword + "'");
        consume();
    }

    @Override
    public boolean parseOptionalPunct(String punct) throws ParseException {
        Token.Kind kind = PUNCTUATION.get(punct);
        if (kind == null) throw new IllegalArgumentException("not punctuation: " + punct);
        if (!tok.is(kind)) return false;
        consume();
        return true;
    }

    @Override
    public void parsePunct(String punct) throws ParseException {
        if (!parseOptionalPunct(punct)) throw error("expected '" + punct + "'");
    }

    @Override
    public @Nullable Long parseOptionalInteger() throws ParseException {
        Token start = tok;
        boolean negative = false;
        if (tok.is(Token.Kind.MINUS)) {
            consume();
            negative = true;
            if (!tok.is(Token.Kind.INTEGER)) {
                resetTo(start);
                return null;
            }
        }
        if (!tok.is(Token.Kind.INTEGER)) return null;
        long value = parseIntegerText(tok, negative);
        consume();
        return value;
    }

    private long parseIntegerText(Token token, boolean negative) throws ParseException {
        try {
            return Long.parseLong(negative ? "-" + token.text : token.text);
        } catch (NumberFormatException e) {
            throw errorAt(token, "integer constant out of range");
        }
    }

    @Override
    public long parseInteger() throws ParseException {
        Long value = parseOptionalInteger();
        if (value == null) throw error("expected integer value");
        return value;
    }

    // operations

    private Operation parseOperation() throws ParseException {
        List<UnresolvedOperand> resultNames = new ArrayList<>();
        Token start = tok;
        if (tok.is(Token.Kind.PERCENT_IDENT)) {
            resultNames = parseOperandList();
            parsePunct("=");
        }
        Location location = getCurrentLocation();
        Operation op;
        if (tok.is(Token.Kind.STRING)) {
            op = parseGenericOperation(location);
        } else if (tok.is(Token.Kind.BARE_IDENT)) {
            op = parseCustomOperation(location);
        } else {
            throw error("expected operation name in quotes");
        }
        if (!resultNames.isEmpty() && resultNames.size() != op.getNumResults()) {
            throw errorAt(start, "operation defines " + op.getNumResults() + " results but was provided "
                    + resultNames.size() + " to bind");
        }
        for (int i = 0; i < resultNames.size(); i++) {
            defineValue(resultNames.get(i), op.getResult(i));
        }
        return op;
    }

    private Operation parseGenericOperation(Location location) throws ParseException {
        String name = Lexer.unescape(tok.text);
        OpKey key = context.getOpKey(name);
        if (key == null) throw error("operation '" + name + "' is not registered");
        consume();
        OperationState state = new OperationState(location, key);
        parsePunct("(");
        List<UnresolvedOperand> operands = parseOperandList();
        parsePunct(")");
        if (parseOptionalPunct("[")) {
            do {
                parseSuccessor(state);
            } while (parseOptionalPunct(","));
            parsePunct("]");
        }
        if (parseOptionalPunct("(")) {
            do {
                parseRegion(state.addRegion(), List.of(), List.of());
            } while (parseOptionalPunct(","));
            parsePunct(")");
        }
        parseOptionalAttrDict(state);
        parsePunct(":");
        Location typeLoc = getCurrentLocation();
        Type type = parseType();
        if (!(type instanceof FunctionType)) {
            throw new ParseException(typeLoc, "expected function type");
        }
        FunctionType fnType = (FunctionType) type;
        state.addOperands(resolveOperands(operands, fnType.getInputs(), typeLoc));
        state.addTypes(fnType.getResults());
        return finishOperation(state);
    }

    private void parseSuccessor(OperationState state) throws ParseException {
        if (!tok.is(Token.Kind.CARET_IDENT)) throw error("expected block name");
        Block block = getBlockRef(tok);
        consume();
        List<Value> operands = new ArrayList<>();
        if (parseOptionalPunct("(")) {
            List<UnresolvedOperand> names = parseOperandList();
            Location typeLoc = getCurrentLocation();
            List<Type> types = parseColonTypeList();
            operands = resolveOperands(names, types, typeLoc);
            parsePunct(")");
        }
        state.addSuccessor(block, operands);
    }

    private @Nullable OpKey resolveCustomName(String name) {
        OpKey key = context.lookupRegistered(name);
        if (key == null && name.indexOf('.') < 0) {
            key = context.lookupRegistered("std." + name);
        }
        return key;
    }

    private Operation parseCustomOperation(Location location) throws ParseException {
        OpKey key = resolveCustomName(tok.text);
        OpParser parser = key == null ? null : key.getNullable(CommonExts.PARSER);
        if (parser == null) throw error("custom op '" + tok.text + "' is unknown");
        consume();
        OperationState state = new OperationState(location, key);
        parser.parse(this, state);
        return finishOperation(state);
    }

    private Operation finishOperation(OperationState state) {
        Operation op = Operation.create(state);
        created.add(op);
        return op;
    }

    // values and blocks

    private void defineValue(UnresolvedOperand name, Value value) throws ParseException {
        Scope scope = scopes.element();
        if (scope.values.containsKey(name.getName())) {
            throw new ParseException(name.getLocation(), "redefinition of SSA value '" + name + "'");
        }
        scope.values.put(name.getName(), value);
        Value placeholder = scope.forwardRefs.remove(name.getName());
        if (placeholder != null) {
            scope.forwardRefLocs.remove(name.getName());
            if (!placeholder.getType().equals(value.getType())) {
                throw new ParseException(name.getLocation(), "definition of SSA value '" + name + "' has type "
                        + value.getType() + " but was previously used with type " + placeholder.getType());
            }
            replacePlaceholder(placeholder, value);
        }
    }

    private static void replacePlaceholder(Value placeholder, Value value) {
        placeholder.replaceAllUsesWith(value);
        Operation placeholderOp = placeholder.getDefiningOp();
        if (placeholderOp != null) placeholderOp.destroy();
    }

    @Override
    public Value resolveOperand(UnresolvedOperand operand, Type type) throws ParseException {
        String name = operand.getName();
        for (Scope scope : scopes) {
            Value value = scope.values.get(name);
            if (value != null) return checkUseType(operand, value, type);
        }
        for (Scope scope : scopes) {
            Value value = scope.forwardRefs.get(name);
            if (value != null) return checkUseType(operand, value, type);
        }
        Operation placeholder = Operation.create(operand.getLocation(), FORWARD_REF,
                List.of(), List.of(type), List.of(), 0);
        created.add(placeholder);
        Scope scope = scopes.element();
        scope.forwardRefs.put(name, placeholder.getResult(0));
        scope.forwardRefLocs.put(name, operand.getLocation());
        return placeholder.getResult(0);
    }

    private static Value checkUseType(UnresolvedOperand operand, Value value, Type type) throws ParseException {
        if (!value.getType().equals(type)) {
            throw new ParseException(operand.getLocation(), "use of value '" + operand
                    + "' expects different type than prior uses: '" + type + "' vs '" + value.getType() + "'");
        }
        return value;
    }

    @Override
    public List<Value> resolveOperands(List<UnresolvedOperand> operands, Type type) throws ParseException {
        List<Value> values = new ArrayList<>(operands.size());
        for (UnresolvedOperand operand : operands) {
            values.add(resolveOperand(operand, type));
        }
        return values;
    }

    @Override
    public List<Value> resolveOperands(List<UnresolvedOperand> operands, List<Type> types, Location location)
            throws ParseException {
        if (operands.size() != types.size()) {
            throw new ParseException(location, operands.size() + " operands present, but expected " + types.size());
        }
        List<Value> values = new ArrayList<>(operands.size());
        for (int i = 0; i < operands.size(); i++) {
            values.add(resolveOperand(operands.get(i), types.get(i)));
        }
        return values;
    }

    private Block getBlockRef(Token name) {
        Scope scope = scopes.element();
        scope.blockRefLocs.putIfAbsent(name.text, lexer.locationOf(name));
        return scope.blocks.computeIfAbsent(name.text, k -> new Block());
    }

    private void pushScope() {
        scopes.push(new Scope());
    }

    private void popScope() throws ParseException {
        Scope scope = scopes.pop();
        for (String name : scope.blocks.keySet()) {
            if (!scope.definedBlocks.contains(name)) {
                throw new ParseException(scope.blockRefLocs.get(name), "reference to an undefined block '" + name + "'");
            }
        }
        Scope parent = scopes.peek();
        for (Map.Entry<String, Value> entry : scope.forwardRefs.entrySet()) {
            String name = entry.getKey();
            Location location = scope.forwardRefLocs.get(name);
            if (parent == null) {
                throw new ParseException(location, "use of undeclared SSA value name '" + name + "'");
            }
            Value existing = parent.forwardRefs.get(name);
            if (existing == null) {
                parent.forwardRefs.put(name, entry.getValue());
                parent.forwardRefLocs.put(name, location);
            } else if (!existing.getType().equals(entry.getValue().getType())) {
                throw new ParseException(location, "use of value '" + name
                        + "' expects different type than prior uses: '" + entry.getValue().getType()
                        + "' vs '" + existing.getType() + "'");
            } else {
                replacePlaceholder(entry.getValue(), existing);
            }
        }
    }

    @Override
    public @Nullable UnresolvedOperand parseOptionalOperand() throws ParseException {
        if (!tok.is(Token.Kind.PERCENT_IDENT)) return null;
        UnresolvedOperand operand = new UnresolvedOperand(tok.text, getCurrentLocation());
        consume();
        return operand;
    }

    @Override
    public UnresolvedOperand parseOperand() throws ParseException {
        UnresolvedOperand operand = parseOptionalOperand();
        if (operand == null) throw error("expected SSA operand");
        return operand;
    }

    @Override
    public List<UnresolvedOperand> parseOperandList() throws ParseException {
        List<UnresolvedOperand> operands = new ArrayList<>();
        if (!tok.is(Token.Kind.PERCENT_IDENT)) return operands;
        do {
            operands.add(parseOperand());
        } while (parseOptionalPunct(","));
        return operands;
    }

    @Override
    public int parseDimAndSymbolList(List<UnresolvedOperand> operands) throws ParseException {
        parsePunct("(");
        operands.addAll(parseOperandList());
        parsePunct(")");
        int numDims = operands.size();
        if (parseOptionalPunct("[")) {
            operands.addAll(parseOperandList());
            parsePunct("]");
        }
        return numDims;
    }

    // regions

    @Override
    public void parseRegion(Region region, List<UnresolvedOperand> arguments, List<Type> argTypes)
            throws ParseException {
        parsePunct("{");
        pushScope();
        Block entry = null;
        if (!arguments.isEmpty()) {
            if (tok.is(Token.Kind.CARET_IDENT)) throw error("invalid block name in region with named arguments");
            entry = region.addBlock();
            for (int i = 0; i < arguments.size(); i++) {
                defineValue(arguments.get(i), entry.addArgument(argTypes.get(i)));
            }
        }
        if (!tok.is(Token.Kind.R_BRACE)) {
            if (entry == null && !tok.is(Token.Kind.CARET_IDENT)) entry = region.addBlock();
            if (entry != null) parseBlockBody(entry);
            while (tok.is(Token.Kind.CARET_IDENT)) {
                parseLabeledBlock(region);
            }
        }
        parsePunct("}");
        popScope();
    }

    @Override
    public boolean parseOptionalRegion(Region region, List<UnresolvedOperand> arguments, List<Type> argTypes)
            throws ParseException {
        if (!tok.is(Token.Kind.L_BRACE)) return false;
        parseRegion(region, arguments, argTypes);
        return true;
    }

    private void parseBlockBody(Block block) throws ParseException {
        while (!tok.is(Token.Kind.R_BRACE) && !tok.is(Token.Kind.CARET_IDENT) && !tok.is(Token.Kind.EOF)) {
            block.addOperation(parseOperation());
        }
    }

    private void parseLabeledBlock(Region region) throws ParseException {
        Token label = tok;
        Scope scope = scopes.element();
        Block block = getBlockRef(label);
        if (!scope.definedBlocks.add(label.text)) {
            throw errorAt(label, "redefinition of block '" + label.text + "'");
        }
        consume();
        region.addBlock(block);
        if (parseOptionalPunct("(")) {
            if (!tok.is(Token.Kind.R_PAREN)) {
                do {
                    UnresolvedOperand arg = parseOperand();
                    parsePunct(":");
                    defineValue(arg, block.addArgument(parseType()));
                } while (parseOptionalPunct(","));
            }
            parsePunct(")");
        }
        parsePunct(":");
        parseBlockBody(block);
    }

    // types

    @Override
    public Type parseType() throws ParseException {
        if (tok.is(Token.Kind.L_PAREN)) return parseFunctionType();
        if (!tok.is(Token.Kind.BARE_IDENT)) throw error("expected type");
        Token typeTok = tok;
        String text = tok.text;
        if (text.equals("index")) {
            consume();
            return IndexType.get();
        }
        if (text.equals("memref")) {
            return parseMemRefType();
        }
        if (text.length() > 1 && (text.charAt(0) == 'i' || text.charAt(0) == 'f')
                && text.substring(1).chars().allMatch(Character::isDigit)) {
            consume();
            int width;
            try {
                width = Integer.parseInt(text.substring(1));
                return text.charAt(0) == 'i' ? IntegerType.get(width) : FloatType.get(width);
            } catch (IllegalArgumentException e) {
                throw errorAt(typeTok, "invalid type width in '" + text + "'");
            }
        }
        throw error("unknown type '" + text + "'");
    }

    private Type parseFunctionType() throws ParseException {
        parsePunct("(");
        List<Type> inputs = new ArrayList<>();
        if (!tok.is(Token.Kind.R_PAREN)) {
            do {
                inputs.add(parseType());
            } while (parseOptionalPunct(","));
        }
        parsePunct(")");
        parsePunct("->");
        return FunctionType.get(inputs, parseResultTypeList());
    }

    @Override
    public List<Type> parseResultTypeList() throws ParseException {
        List<Type> types = new ArrayList<>();
        if (parseOptionalPunct("(")) {
            if (!tok.is(Token.Kind.R_PAREN)) {
                do {
                    types.add(parseType());
                } while (parseOptionalPunct(","));
            }
            parsePunct(")");
        } else {
            types.add(parseType());
        }
        return types;
    }

    private Type parseMemRefType() throws ParseException {
        consume();
        if (!tok.is(Token.Kind.LESS)) throw error("expected '<' in memref type");
        // the lexer sits just after the '<'
        List<Long> shape = new ArrayList<>();
        String extent;
        while ((extent = lexer.lexShapeDimension()) != null) {
            if (extent.equals("?")) {
                shape.add(MemRefType.DYNAMIC);
            } else {
                try {
                    shape.add(Long.parseLong(extent));
                } catch (NumberFormatException e) {
                    throw error("invalid memref extent '" + extent + "'");
                }
            }
        }
        consume();
        Type elementType = parseType();
        int memorySpace = 0;
        if (parseOptionalPunct(",")) {
            memorySpace = Math.toIntExact(parseInteger());
        }
        parsePunct(">");
        long[] dims = new long[shape.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = shape.get(i);
        }
        return MemRefType.get(dims, elementType, memorySpace);
    }

    @Override
    public Type parseColonType() throws ParseException {
        parsePunct(":");
        return parseType();
    }

    @Override
    public List<Type> parseColonTypeList() throws ParseException {
        parsePunct(":");
        List<Type> types = new ArrayList<>();
        do {
            types.add(parseType());
        } while (parseOptionalPunct(","));
        return types;
    }

    // attributes

    @Override
    public Attribute parseAttribute() throws ParseException {
        Token start = tok;
        if (tok.is(Token.Kind.MINUS) || tok.is(Token.Kind.INTEGER) || tok.is(Token.Kind.FLOAT)) {
            return parseNumberAttribute();
        }
        if (tok.is(Token.Kind.STRING)) {
            String value = Lexer.unescape(tok.text);
            consume();
            return StringAttr.get(value);
        }
        if (parseOptionalPunct("[")) {
            List<Attribute> elements = new ArrayList<>();
            if (!tok.is(Token.Kind.R_SQUARE)) {
                do {
                    elements.add(parseAttribute());
                } while (parseOptionalPunct(","));
            }
            parsePunct("]");
            return ArrayAttr.get(elements);
        }
        if (parseOptionalKeyword("unit")) return UnitAttr.get();
        if (parseOptionalKeyword("affine_map")) {
            parsePunct("<");
            AffineMap map = parseAffineMap();
            parsePunct(">");
            return AffineMapAttr.get(map);
        }
        if (parseOptionalKeyword("affine_set")) {
            parsePunct("<");
            IntegerSet set = parseIntegerSet();
            parsePunct(">");
            return IntegerSetAttr.get(set);
        }
        if (tok.is(Token.Kind.BARE_IDENT) || tok.is(Token.Kind.L_PAREN)) {
            return TypeAttr.get(parseType());
        }
        throw errorAt(start, "expected attribute value");
    }

    private Attribute parseNumberAttribute() throws ParseException {
        boolean negative = parseOptionalPunct("-");
        Token number = tok;
        if (tok.is(Token.Kind.FLOAT)) {
            consume();
            double value = Double.parseDouble(number.text);
            if (negative) value = -value;
            Type type = FloatType.get(64);
            if (parseOptionalPunct(":")) type = parseType();
            if (!(type instanceof FloatType)) throw errorAt(number, "floating point value not valid for specified type");
            return FloatAttr.get(value, (FloatType) type);
        }
        if (!tok.is(Token.Kind.INTEGER)) throw error("expected integer or floating point literal");
        long value = parseIntegerText(number, negative);
        consume();
        Type type = IntegerType.get(64);
        if (parseOptionalPunct(":")) type = parseType();
        if (type instanceof FloatType) return FloatAttr.get(value, (FloatType) type);
        if (!type.isIntOrIndex()) throw errorAt(number, "integer literal not valid for specified type");
        return IntegerAttr.get(value, type);
    }

    @Override
    public String parseSymbolName() throws ParseException {
        if (!tok.is(Token.Kind.AT_IDENT)) throw error("expected symbol name");
        String name = tok.text.substring(1);
        consume();
        return name;
    }

    @Override
    public void parseOptionalAttrDict(OperationState state) throws ParseException {
        if (!parseOptionalPunct("{")) return;
        if (!tok.is(Token.Kind.R_BRACE)) {
            do {
                String name;
                if (tok.is(Token.Kind.BARE_IDENT)) {
                    name = tok.text;
                } else if (tok.is(Token.Kind.STRING)) {
                    name = Lexer.unescape(tok.text);
                } else {
                    throw error("expected attribute name");
                }
                consume();
                state.addAttribute(name, parseOptionalPunct("=") ? parseAttribute() : UnitAttr.get());
            } while (parseOptionalPunct(","));
        }
        parsePunct("}");
    }

    // affine structures

    @Override
    public AffineMap parseAffineMap() throws ParseException {
        Map<String, AffineExpr> ids = new HashMap<>();
        int[] counts = parseDimAndSymbolIdLists(ids);
        parsePunct("->");
        parsePunct("(");
        List<AffineExpr> results = new ArrayList<>();
        AtomParser atoms = identifierAtoms(ids);
        if (!tok.is(Token.Kind.R_PAREN)) {
            do {
                results.add(parseAffineExpr(atoms));
            } while (parseOptionalPunct(","));
        }
        parsePunct(")");
        return AffineMap.get(counts[0], counts[1], results);
    }

    @Override
    public IntegerSet parseIntegerSet() throws ParseException {
        Map<String, AffineExpr> ids = new HashMap<>();
        int[] counts = parseDimAndSymbolIdLists(ids);
        parsePunct(":");
        parsePunct("(");
        AtomParser atoms = identifierAtoms(ids);
        List<AffineExpr> constraints = new ArrayList<>();
        List<Boolean> eqFlags = new ArrayList<>();
        if (tok.is(Token.Kind.R_PAREN)) throw error("expected a valid affine constraint");
        do {
            AffineExpr lhs = parseAffineExpr(atoms);
            if (parseOptionalPunct(">=")) {
                constraints.add(lhs.sub(parseAffineExpr(atoms)));
                eqFlags.add(false);
            } else if (parseOptionalPunct("<=")) {
                constraints.add(parseAffineExpr(atoms).sub(lhs));
                eqFlags.add(false);
            } else if (parseOptionalPunct("==")) {
                constraints.add(lhs.sub(parseAffineExpr(atoms)));
                eqFlags.add(true);
            } else {
                throw error("expected '==', '>=' or '<=' in affine constraint");
            }
        } while (parseOptionalPunct(","));
        parsePunct(")");
        return IntegerSet.get(counts[0], counts[1], constraints, eqFlags);
    }

    private int[] parseDimAndSymbolIdLists(Map<String, AffineExpr> ids) throws ParseException {
        parsePunct("(");
        int numDims = 0;
        if (!tok.is(Token.Kind.R_PAREN)) {
            do {
                declareIdentifier(ids, AffineExpr.dim(numDims++));
            } while (parseOptionalPunct(","));
        }
        parsePunct(")");
        int numSymbols = 0;
        if (parseOptionalPunct("[")) {
            if (!tok.is(Token.Kind.R_SQUARE)) {
                do {
                    declareIdentifier(ids, AffineExpr.symbol(numSymbols++));
                } while (parseOptionalPunct(","));
            }
            parsePunct("]");
        }
        return new int[]{numDims, numSymbols};
    }

    private void declareIdentifier(Map<String, AffineExpr> ids, AffineExpr expr) throws ParseException {
        if (!tok.is(Token.Kind.BARE_IDENT)) throw error("expected bare identifier");
        if (ids.putIfAbsent(tok.text, expr) != null) {
            throw error("redefinition of identifier '" + tok.text + "'");
        }
        consume();
    }

    private AtomParser identifierAtoms(Map<String, AffineExpr> ids) {
        return () -> {
            if (!tok.is(Token.Kind.BARE_IDENT)) return null;
            AffineExpr expr = ids.get(tok.text);
            if (expr == null) throw error("use of undeclared identifier '" + tok.text + "'");
            consume();
            return expr;
        };
    }

    @Override
    public AffineMap parseAffineMapOfSSAIds(List<UnresolvedOperand> operands) throws ParseException {
        parsePunct("[");
        List<UnresolvedOperand> dims = new ArrayList<>();
        List<UnresolvedOperand> syms = new ArrayList<>();
        Map<String, Integer> dimPositions = new HashMap<>();
        Map<String, Integer> symPositions = new HashMap<>();
        AtomParser atoms = () -> {
            if (tok.is(Token.Kind.PERCENT_IDENT)) {
                UnresolvedOperand operand = parseOperand();
                return AffineExpr.dim(dimPositions.computeIfAbsent(operand.getName(), n -> {
                    dims.add(operand);
                    return dims.size() - 1;
                }));
            }
            if (parseOptionalKeyword("symbol")) {
                parsePunct("(");
                UnresolvedOperand operand = parseOperand();
                parsePunct(")");
                return AffineExpr.symbol(symPositions.computeIfAbsent(operand.getName(), n -> {
                    syms.add(operand);
                    return syms.size() - 1;
                }));
            }
            return null;
        };
        List<AffineExpr> results = new ArrayList<>();
        if (!tok.is(Token.Kind.R_SQUARE)) {
            do {
                results.add(parseAffineExpr(atoms));
            } while (parseOptionalPunct(","));
        }
        parsePunct("]");
        operands.addAll(dims);
        operands.addAll(syms);
        return AffineMap.get(dims.size(), syms.size(), results);
    }

    private AffineExpr parseAffineExpr(AtomParser atoms) throws ParseException {
        AffineExpr lhs = parseAffineTerm(atoms);
        while (true) {
            if (parseOptionalPunct("+")) {
                lhs = lhs.add(parseAffineTerm(atoms));
            } else if (parseOptionalPunct("-")) {
                lhs = lhs.sub(parseAffineTerm(atoms));
            } else {
                return lhs;
            }
        }
    }

    private AffineExpr parseAffineTerm(AtomParser atoms) throws ParseException {
        AffineExpr lhs = parseAffineUnary(atoms);
        while (true) {
            Token op = tok;
            if (parseOptionalPunct("*")) {
                AffineExpr rhs = parseAffineUnary(atoms);
                if (!lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant()) {
                    throw errorAt(op, "non-affine expression: at least one of the multiply operands "
                            + "has to be either a constant or symbolic");
                }
                lhs = lhs.mul(rhs);
            } else if (tok.isKeyword("floordiv") || tok.isKeyword("ceildiv") || tok.isKeyword("mod")) {
                consume();
                AffineExpr rhs = parseAffineUnary(atoms);
                if (!rhs.isSymbolicOrConstant()) {
                    throw errorAt(op, "non-affine expression: right operand of " + op.text
                            + " has to be either a constant or symbolic");
                }
                switch (op.text) {
                    case "floordiv":
                        lhs = lhs.floorDiv(rhs);
                        break;
                    case "ceildiv":
                        lhs = lhs.ceilDiv(rhs);
                        break;
                    default:
                        lhs = lhs.mod(rhs);
                }
            } else {
                return lhs;
            }
        }
    }

    private AffineExpr parseAffineUnary(AtomParser atoms) throws ParseException {
        if (parseOptionalPunct("-")) {
            return parseAffineUnary(atoms).neg();
        }
        if (tok.is(Token.Kind.INTEGER)) {
            long value = parseIntegerText(tok, false);
            consume();
            return AffineExpr.constant(value);
        }
        if (parseOptionalPunct("(")) {
            AffineExpr inner = parseAffineExpr(atoms);
            parsePunct(")");
            return inner;
        }
        AffineExpr atom = atoms.parse();
        if (atom == null) throw error("expected affine expression");
        return atom;
    }
}
