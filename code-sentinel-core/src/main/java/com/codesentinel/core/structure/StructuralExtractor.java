package com.codesentinel.core.structure;

import com.codesentinel.core.model.Construct;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns source text into one {@link LineContext} per physical line.
 *
 * <p>This is a lexical pass, not a parser. A single forward walk keeps a small state
 * (open triple-quoted string, bracket stack, indentation block stack) and tags each line
 * with the constructs its recognizers fire on. One identifier frequency table, filled
 * during the same walk, drives unused-definition detection. Cost is linear in the
 * number of characters.
 *
 * <p>The extractor never fails on malformed input: anything it does not recognize
 * simply contributes no tag.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<LineContext> lines = new StructuralExtractor().extract(SourceUnit.of(code));
 * lines.get(0).has(Construct.ASSIGNMENT);
 * }</pre>
 *
 * @since 1.0.0
 */
public class StructuralExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuralExtractor.class);

    /**
     * Columns a tab advances the indentation by.
     */
    public static final int TAB_WIDTH = 4;

    /**
     * Number of enclosing control-flow blocks at which a line counts as deeply nested.
     */
    public static final int DEEP_NESTING_THRESHOLD = 4;

    private static final Pattern LINE_SPLITTER = Pattern.compile("\r\n|\r|\n");

    private static final Set<String> ENTRY_POINT_NAMES = Set.of("main", "setup", "teardown");

    /**
     * Extracts line facts from a source unit.
     *
     * @param unit source unit
     * @return one line context per physical line, index {@code i} holds line {@code i + 1}
     */
    public List<LineContext> extract(SourceUnit unit) {
        String[] rawLines = LINE_SPLITTER.split(unit.text(), -1);
        int count = rawLines.length;

        List<EnumSet<Construct>> tags = new ArrayList<>(count);
        String[] codeLines = new String[count];
        int[] indents = new int[count];

        LexState state = new LexState();
        Map<String, Integer> identifierCounts = new HashMap<>();
        List<Definition> definitions = new ArrayList<>();

        for (int index = 0; index < count; index++) {
            String raw = rawLines[index];
            int lineNumber = index + 1;
            EnumSet<Construct> lineTags = EnumSet.noneOf(Construct.class);
            tags.add(lineTags);

            boolean startsInString = state.tripleDelimiter != null;
            boolean startsInBrackets = !state.brackets.isEmpty();
            boolean startsContinued = state.backslashContinuation;

            LineScan scan = scanLine(raw, lineNumber, state, lineTags);
            codeLines[index] = scan.code();
            indents[index] = measureIndent(raw);

            if (startsInString) {
                lineTags.add(Construct.DOCSTRING);
            }
            String code = scan.code().strip();
            state.backslashContinuation = code.endsWith("\\");
            countIdentifiers(scan.code(), identifierCounts);

            if (code.isEmpty()) {
                continue;
            }
            if (code.indexOf(';') >= 0) {
                lineTags.add(Construct.STATEMENT_SEPARATOR);
            }
            if (ConstructPatterns.BOOLEAN_OPERATOR.matcher(code).find()) {
                lineTags.add(Construct.BOOLEAN_OPERATOR);
            }

            boolean statementStart = !startsInString && !startsInBrackets && !startsContinued;
            if (statementStart) {
                tagStatement(code, lineTags);
                trackBlocks(code, indents[index], scan, state, lineTags);
                collectDefinition(code, index, definitions);
                if (hasMixedIndentation(raw)) {
                    lineTags.add(Construct.MIXED_INDENTATION);
                }
            } else if (state.pendingHeader != null && state.brackets.isEmpty()) {
                if (code.endsWith(":")) {
                    state.blocks.push(state.pendingHeader);
                }
                state.pendingHeader = null;
            }
        }

        for (OpenBracket bracket : state.brackets) {
            tags.get(bracket.lineNumber() - 1).add(Construct.UNCLOSED_BRACKET);
        }
        if (state.tripleDelimiter != null) {
            tags.get(state.tripleStartLine - 1).add(Construct.UNTERMINATED_STRING);
        }
        markUnusedDefinitions(definitions, identifierCounts, tags);

        List<LineContext> lines = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            lines.add(new LineContext(index + 1, rawLines[index], codeLines[index], indents[index], tags.get(index)));
        }
        log.debug("Extracted {} lines from {}", count, unit.fileNameOr("<input>"));
        return lines;
    }

    // ==================== Lexical Walk ====================

    /**
     * Masks string contents and comments of one line, maintaining string and bracket state.
     */
    private LineScan scanLine(String raw, int lineNumber, LexState state, EnumSet<Construct> lineTags) {
        StringBuilder code = new StringBuilder(raw.length());
        boolean topLevelColon = false;
        int length = raw.length();
        int i = 0;

        while (i < length) {
            if (state.tripleDelimiter != null) {
                lineTags.add(Construct.LITERAL_STRING);
                char ch = raw.charAt(i);
                if (ch == '\\') {
                    int consumed = Math.min(2, length - i);
                    code.append(" ".repeat(consumed));
                    i += 2;
                } else if (raw.startsWith(state.tripleDelimiter, i)) {
                    code.append(state.tripleDelimiter);
                    i += 3;
                    state.tripleDelimiter = null;
                } else {
                    code.append(' ');
                    i++;
                }
                continue;
            }

            char ch = raw.charAt(i);
            if (ch == '#') {
                lineTags.add(Construct.COMMENT);
                break;
            }
            if (ch == '"' || ch == '\'') {
                lineTags.add(Construct.LITERAL_STRING);
                String triple = String.valueOf(ch).repeat(3);
                if (raw.startsWith(triple, i)) {
                    state.tripleDelimiter = triple;
                    state.tripleStartLine = lineNumber;
                    code.append(triple);
                    i += 3;
                    continue;
                }
                i = maskSingleLineString(raw, i, ch, code, lineTags);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                state.brackets.push(new OpenBracket(ch, lineNumber));
            } else if (ch == ')' || ch == ']' || ch == '}') {
                OpenBracket top = state.brackets.peek();
                if (top != null && top.closer() == ch) {
                    state.brackets.pop();
                } else {
                    lineTags.add(Construct.UNMATCHED_BRACKET);
                }
            } else if (ch == ':' && state.brackets.isEmpty()) {
                topLevelColon = true;
            }
            code.append(ch);
            i++;
        }
        return new LineScan(code.toString(), topLevelColon);
    }

    /**
     * Masks a single-quoted or double-quoted string starting at {@code start}.
     *
     * @return index just past the string, or the line length when it never closes
     */
    private int maskSingleLineString(String raw, int start, char quote, StringBuilder code,
                                     EnumSet<Construct> lineTags) {
        int length = raw.length();
        code.append(quote);
        int i = start + 1;
        while (i < length) {
            char ch = raw.charAt(i);
            if (ch == '\\') {
                if (i + 1 >= length) {
                    // backslash-newline continues the string on the next line
                    code.append(' ');
                    return length;
                }
                code.append("  ");
                i += 2;
                continue;
            }
            if (ch == quote) {
                code.append(quote);
                return i + 1;
            }
            code.append(' ');
            i++;
        }
        lineTags.add(Construct.UNTERMINATED_STRING);
        return length;
    }

    // ==================== Statement Recognizers ====================

    private void tagStatement(String code, EnumSet<Construct> lineTags) {
        tagIf(ConstructPatterns.IMPORT, code, Construct.IMPORT, lineTags);
        tagIf(ConstructPatterns.FUNCTION_DEF, code, Construct.FUNCTION_DEF, lineTags);
        tagIf(ConstructPatterns.CLASS_DEF, code, Construct.CLASS_DEF, lineTags);
        tagIf(ConstructPatterns.DECORATOR, code, Construct.DECORATOR, lineTags);
        tagIf(ConstructPatterns.CONDITIONAL, code, Construct.CONDITIONAL, lineTags);
        tagIf(ConstructPatterns.LOOP, code, Construct.LOOP, lineTags);
        tagIf(ConstructPatterns.EXCEPTION_HANDLER, code, Construct.EXCEPTION_HANDLER, lineTags);
        tagIf(ConstructPatterns.BARE_EXCEPT, code, Construct.BARE_EXCEPT, lineTags);
        tagIf(ConstructPatterns.RETURN, code, Construct.RETURN, lineTags);
        tagIf(ConstructPatterns.TERMINATOR, code, Construct.TERMINATOR, lineTags);
        tagIf(ConstructPatterns.GLOBAL_DECL, code, Construct.GLOBAL_DECL, lineTags);
        tagIf(ConstructPatterns.BLOCK_HEADER, code, Construct.BLOCK_HEADER, lineTags);

        String leading = ConstructPatterns.leadingIdentifier(code);
        if (!ConstructPatterns.KEYWORDS.contains(leading)) {
            tagIf(ConstructPatterns.ASSIGNMENT, code, Construct.ASSIGNMENT, lineTags);
            tagIf(ConstructPatterns.AUGMENTED_ASSIGNMENT, code, Construct.AUGMENTED_ASSIGNMENT, lineTags);
        }
    }

    private void tagIf(Pattern pattern, String code, Construct construct, EnumSet<Construct> lineTags) {
        if (pattern.matcher(code).find()) {
            lineTags.add(construct);
        }
    }

    // ==================== Indentation Blocks ====================

    private void trackBlocks(String code, int indent, LineScan scan, LexState state, EnumSet<Construct> lineTags) {
        if (state.pendingTerminatorIndent >= 0) {
            if (indent == state.pendingTerminatorIndent
                && !ConstructPatterns.CONTINUATION_CLAUSE.matcher(code).find()) {
                lineTags.add(Construct.UNREACHABLE);
            }
            state.pendingTerminatorIndent = -1;
        }
        state.pendingHeader = null;

        while (!state.blocks.isEmpty() && state.blocks.peek().indent() >= indent) {
            state.blocks.pop();
        }

        int controlDepth = 0;
        for (Block block : state.blocks) {
            if (block.kind() == BlockKind.LOOP) {
                lineTags.add(Construct.LOOP_BODY);
            }
            if (block.kind() != BlockKind.DEFINITION) {
                controlDepth++;
            }
        }
        if (controlDepth >= DEEP_NESTING_THRESHOLD) {
            lineTags.add(Construct.DEEP_NESTING);
        }

        if (lineTags.contains(Construct.BLOCK_HEADER)) {
            Block block = new Block(indent, blockKind(lineTags));
            if (!state.brackets.isEmpty() || state.backslashContinuation) {
                state.pendingHeader = block;
            } else if (code.endsWith(":")) {
                state.blocks.push(block);
            } else if (!scan.topLevelColon()) {
                lineTags.add(Construct.MISSING_COLON);
            }
        }
        if (lineTags.contains(Construct.TERMINATOR)) {
            state.pendingTerminatorIndent = indent;
        }
    }

    private BlockKind blockKind(EnumSet<Construct> lineTags) {
        if (lineTags.contains(Construct.LOOP)) {
            return BlockKind.LOOP;
        }
        if (lineTags.contains(Construct.FUNCTION_DEF) || lineTags.contains(Construct.CLASS_DEF)) {
            return BlockKind.DEFINITION;
        }
        return BlockKind.CONTROL;
    }

    private int measureIndent(String raw) {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += TAB_WIDTH;
            } else if (ch != '\f') {
                break;
            }
        }
        return width;
    }

    private boolean hasMixedIndentation(String raw) {
        boolean spaces = false;
        boolean tabs = false;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == ' ') {
                spaces = true;
            } else if (ch == '\t') {
                tabs = true;
            } else {
                break;
            }
        }
        return spaces && tabs;
    }

    // ==================== Unused Definitions ====================

    private void countIdentifiers(String code, Map<String, Integer> counts) {
        Matcher matcher = ConstructPatterns.IDENTIFIER.matcher(code);
        while (matcher.find()) {
            counts.merge(matcher.group(), 1, Integer::sum);
        }
    }

    private void collectDefinition(String code, int index, List<Definition> definitions) {
        Matcher function = ConstructPatterns.FUNCTION_DEF.matcher(code);
        if (function.find()) {
            definitions.add(new Definition(function.group(1), index));
            return;
        }
        Matcher type = ConstructPatterns.CLASS_DEF.matcher(code);
        if (type.find()) {
            definitions.add(new Definition(type.group(1), index));
            return;
        }
        Matcher assignment = ConstructPatterns.SIMPLE_DEFINITION.matcher(code);
        if (assignment.find() && !ConstructPatterns.KEYWORDS.contains(assignment.group(1))) {
            definitions.add(new Definition(assignment.group(1), index));
        }
    }

    private void markUnusedDefinitions(List<Definition> definitions, Map<String, Integer> identifierCounts,
                                       List<EnumSet<Construct>> tags) {
        Map<String, Integer> definitionCounts = new HashMap<>();
        for (Definition definition : definitions) {
            definitionCounts.merge(definition.name(), 1, Integer::sum);
        }
        for (Definition definition : definitions) {
            String name = definition.name();
            if (isExemptFromUnusedCheck(name)) {
                continue;
            }
            int occurrences = identifierCounts.getOrDefault(name, 0);
            if (occurrences <= definitionCounts.get(name)) {
                tags.get(definition.lineIndex()).add(Construct.UNUSED_DEFINITION);
            }
        }
    }

    private boolean isExemptFromUnusedCheck(String name) {
        return name.startsWith("_") || name.startsWith("test") || ENTRY_POINT_NAMES.contains(name);
    }

    // ==================== State ====================

    private enum BlockKind { LOOP, CONTROL, DEFINITION }

    private record Block(int indent, BlockKind kind) {}

    private record OpenBracket(char opener, int lineNumber) {
        char closer() {
            return switch (opener) {
                case '(' -> ')';
                case '[' -> ']';
                default -> '}';
            };
        }
    }

    private record Definition(String name, int lineIndex) {}

    private record LineScan(String code, boolean topLevelColon) {}

    private static final class LexState {
        private String tripleDelimiter;
        private int tripleStartLine;
        private boolean backslashContinuation;
        private int pendingTerminatorIndent = -1;
        private Block pendingHeader;
        private final Deque<OpenBracket> brackets = new ArrayDeque<>();
        private final Deque<Block> blocks = new ArrayDeque<>();
    }
}
