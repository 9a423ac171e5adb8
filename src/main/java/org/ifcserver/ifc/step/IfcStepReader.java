package org.ifcserver.ifc.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * STEP（ISO-10303-21）文本读取器：把 HEADER 与 DATA 段解析为结构化的实例表。
 * <p>
 * 用途：
 * <ul>
 *   <li>对写出的 IFC 文本做“回读校验”（悬空引用、重复标签、GlobalId 重复等）。</li>
 *   <li>读取已保存的 {@code .ifc} 文件并生成摘要。</li>
 * </ul>
 * <p>
 * 注意：这不是通用的 EXPRESS/STEP 引擎，只覆盖本项目写出的语法子集（字符串、引用、列表、枚举、数字、
 * 带类型值、{@code $}/{@code *}）；遇到无法解析的语句会跳过并记录 warning。
 */
public final class IfcStepReader {

    private static final Pattern HEADER_START = Pattern.compile("(?is)\\bHEADER\\b\\s*;");
    private static final Pattern FILE_DESCRIPTION = Pattern.compile("(?is)\\bFILE_DESCRIPTION\\b\\s*\\(");
    private static final Pattern FILE_NAME = Pattern.compile("(?is)\\bFILE_NAME\\b\\s*\\(");
    private static final Pattern FILE_SCHEMA = Pattern.compile("(?is)\\bFILE_SCHEMA\\b\\s*\\(");

    private IfcStepReader() {
    }

    // ------------------------------------------------------------------
    // 参数值模型
    // ------------------------------------------------------------------

    public interface StepValue {
    }

    public record StepNull() implements StepValue {
    }

    public record StepDerived() implements StepValue {
    }

    public record StepString(String value) implements StepValue {
    }

    public record StepRef(int id) implements StepValue {
    }

    public record StepEnum(String value) implements StepValue {
    }

    public record StepNumber(String raw, Double value) implements StepValue {
    }

    public record StepList(List<StepValue> items) implements StepValue {
    }

    public record StepTyped(String typeUpper, List<StepValue> args) implements StepValue {
    }

    /**
     * DATA 段中的一条实例：{@code #id=TYPE(args);}
     */
    public record StepInstance(int id, String typeUpper, List<StepValue> args, String rawText) {

        public String stringAt(int index) {
            if (index < 0 || index >= args.size()) {
                return null;
            }
            return (args.get(index) instanceof StepString s) ? s.value() : null;
        }

        public Integer refAt(int index) {
            if (index < 0 || index >= args.size()) {
                return null;
            }
            return (args.get(index) instanceof StepRef r) ? r.id() : null;
        }
    }

    public record StepHeader(
            List<String> fileDescriptions,
            String implementationLevel,
            String fileName,
            String timeStamp,
            List<String> authors,
            List<String> organizations,
            String preprocessorVersion,
            String originatingSystem,
            String authorization,
            List<String> schemas
    ) {
    }

    /**
     * 解析结果。
     *
     * @param header          头部（未找到 HEADER 段时为 null）
     * @param instances       按标签索引的实例（保持文件中的出现顺序）
     * @param duplicateLabels 出现多次的标签
     * @param warnings        非致命告警
     */
    public record StepFile(
            StepHeader header,
            Map<Integer, StepInstance> instances,
            List<Integer> duplicateLabels,
            List<String> warnings
    ) {
        public List<StepInstance> instancesOfType(String typeUpper) {
            List<StepInstance> out = new ArrayList<>();
            for (StepInstance instance : instances.values()) {
                if (instance.typeUpper().equals(typeUpper)) {
                    out.add(instance);
                }
            }
            return out;
        }
    }

    // ------------------------------------------------------------------
    // 入口
    // ------------------------------------------------------------------

    public static StepFile read(String stepText) {
        List<String> warnings = new ArrayList<>();
        if (stepText == null || stepText.isBlank()) {
            warnings.add("STEP 内容为空，无法解析。");
            return new StepFile(null, Map.of(), List.of(), warnings);
        }

        StepHeader header = readHeader(stepText, warnings);

        Map<Integer, StepInstance> instances = new LinkedHashMap<>();
        List<Integer> duplicates = new ArrayList<>();
        int dataStart = indexOfIgnoreCase(stepText, "DATA;", 0);
        if (dataStart < 0) {
            warnings.add("未找到 DATA 段。");
            return new StepFile(header, instances, duplicates, warnings);
        }

        int cursor = dataStart + "DATA;".length();
        while (cursor < stepText.length()) {
            int next = cursorSkipWs(stepText, cursor);
            if (stepText.regionMatches(true, next, "ENDSEC", 0, "ENDSEC".length())) {
                break;
            }
            int entityStart = stepText.indexOf('#', cursor);
            if (entityStart < 0) {
                break;
            }
            StepInstance instance = parseInstance(stepText, entityStart);
            if (instance == null) {
                warnings.add("无法解析位于偏移 " + entityStart + " 的实例语句，已跳过。");
                int semicolon = findStatementEnd(stepText, entityStart);
                cursor = semicolon < 0 ? stepText.length() : semicolon + 1;
                continue;
            }
            if (instances.containsKey(instance.id())) {
                duplicates.add(instance.id());
            } else {
                instances.put(instance.id(), instance);
            }
            cursor = entityStart + instance.rawText().length();
        }

        return new StepFile(header, Collections.unmodifiableMap(instances), duplicates, warnings);
    }

    /**
     * 读取并汇总 IFC 文本：头部字段、实例类型计数、项目/建筑/楼层名称。
     *
     * @param maxTypes 类型计数最多返回多少项（小于 1 时返回全部）
     */
    public static IfcFileSummary readInfo(String stepText, int maxTypes) {
        StepFile file = read(stepText);
        List<String> warnings = new ArrayList<>(file.warnings());
        if (!file.duplicateLabels().isEmpty()) {
            warnings.add("存在重复的实例标签：" + file.duplicateLabels());
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (StepInstance instance : file.instances().values()) {
            counts.merge(instance.typeUpper(), 1, Integer::sum);
        }
        List<IfcFileSummary.TypeCount> types = new ArrayList<>();
        counts.forEach((type, count) -> types.add(new IfcFileSummary.TypeCount(type, count)));
        types.sort((a, b) -> a.count() != b.count()
                ? Integer.compare(b.count(), a.count())
                : a.type().compareTo(b.type()));
        List<IfcFileSummary.TypeCount> top = (maxTypes > 0 && types.size() > maxTypes)
                ? List.copyOf(types.subList(0, maxTypes))
                : List.copyOf(types);

        // IfcRoot 子类型的 Name 均在第 3 个参数
        List<StepInstance> projects = file.instancesOfType("IFCPROJECT");
        String projectName = projects.isEmpty() ? null : projects.get(0).stringAt(2);
        if (projects.size() > 1) {
            warnings.add("文件包含 " + projects.size() + " 个 IFCPROJECT。");
        }

        StepHeader header = file.header();
        return new IfcFileSummary(
                header == null ? List.of() : header.fileDescriptions(),
                header == null ? null : header.implementationLevel(),
                header == null ? null : header.fileName(),
                header == null ? null : header.timeStamp(),
                header == null ? List.of() : header.authors(),
                header == null ? List.of() : header.organizations(),
                header == null ? null : header.preprocessorVersion(),
                header == null ? null : header.originatingSystem(),
                header == null ? List.of() : header.schemas(),
                file.instances().size(),
                top,
                projectName,
                namesOf(file, "IFCBUILDING"),
                namesOf(file, "IFCBUILDINGSTOREY"),
                counts.getOrDefault("IFCWALLSTANDARDCASE", 0),
                counts.getOrDefault("IFCSPACE", 0),
                warnings
        );
    }

    private static List<String> namesOf(StepFile file, String typeUpper) {
        List<String> names = new ArrayList<>();
        for (StepInstance instance : file.instancesOfType(typeUpper)) {
            String name = instance.stringAt(2);
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    // ------------------------------------------------------------------
    // HEADER
    // ------------------------------------------------------------------

    private static StepHeader readHeader(String stepText, List<String> warnings) {
        Matcher start = HEADER_START.matcher(stepText);
        if (!start.find()) {
            warnings.add("未找到 HEADER 段，文件可能不是有效的 STEP 物理文件。");
            return null;
        }
        int headerStart = start.end();
        int headerEnd = indexOfIgnoreCase(stepText, "ENDSEC", headerStart);
        String header = headerEnd < 0 ? stepText.substring(headerStart) : stepText.substring(headerStart, headerEnd);

        List<String> fileDescriptions = List.of();
        String implementationLevel = null;
        String fileName = null;
        String timeStamp = null;
        List<String> authors = List.of();
        List<String> organizations = List.of();
        String preprocessorVersion = null;
        String originatingSystem = null;
        String authorization = null;
        List<String> schemas = List.of();

        List<StepValue> description = statementArgs(header, FILE_DESCRIPTION);
        if (description == null) {
            warnings.add("未找到 FILE_DESCRIPTION。");
        } else {
            fileDescriptions = strings(arg(description, 0));
            implementationLevel = string(arg(description, 1));
        }

        List<StepValue> name = statementArgs(header, FILE_NAME);
        if (name == null) {
            warnings.add("未找到 FILE_NAME。");
        } else {
            fileName = string(arg(name, 0));
            timeStamp = string(arg(name, 1));
            authors = strings(arg(name, 2));
            organizations = strings(arg(name, 3));
            preprocessorVersion = string(arg(name, 4));
            originatingSystem = string(arg(name, 5));
            authorization = string(arg(name, 6));
        }

        List<StepValue> schema = statementArgs(header, FILE_SCHEMA);
        if (schema == null) {
            warnings.add("未找到 FILE_SCHEMA。");
        } else {
            schemas = strings(arg(schema, 0));
        }

        return new StepHeader(fileDescriptions, implementationLevel, fileName, timeStamp, authors, organizations,
                preprocessorVersion, originatingSystem, authorization, schemas);
    }

    private static List<StepValue> statementArgs(String header, Pattern statementStart) {
        Matcher m = statementStart.matcher(header);
        if (!m.find()) {
            return null;
        }
        int openParen = m.end() - 1;
        int closeParen = findMatchingParen(header, openParen);
        if (closeParen < 0) {
            return null;
        }
        return new Parser(header.substring(openParen + 1, closeParen)).parseArgs();
    }

    private static StepValue arg(List<StepValue> args, int index) {
        return index < args.size() ? args.get(index) : new StepNull();
    }

    private static String string(StepValue value) {
        return (value instanceof StepString s) ? s.value() : null;
    }

    private static List<String> strings(StepValue value) {
        if (value instanceof StepList list) {
            List<String> out = new ArrayList<>();
            for (StepValue item : list.items()) {
                if (item instanceof StepString s) {
                    out.add(s.value());
                }
            }
            return out;
        }
        String single = string(value);
        return single == null ? List.of() : List.of(single);
    }

    // ------------------------------------------------------------------
    // DATA
    // ------------------------------------------------------------------

    private static StepInstance parseInstance(String text, int startIndex) {
        // #123=IFCENTITY(arg1,arg2,...);
        int i = startIndex + 1;
        int id = 0;
        int digits = 0;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            id = id * 10 + (text.charAt(i) - '0');
            digits++;
            i++;
        }
        if (digits == 0) {
            return null;
        }
        i = cursorSkipWs(text, i);
        if (i >= text.length() || text.charAt(i) != '=') {
            return null;
        }
        i = cursorSkipWs(text, i + 1);
        int typeStart = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        if (i == typeStart) {
            return null;
        }
        String typeUpper = text.substring(typeStart, i).toUpperCase(Locale.ROOT);
        i = cursorSkipWs(text, i);
        if (i >= text.length() || text.charAt(i) != '(') {
            return null;
        }
        int closeParen = findMatchingParen(text, i);
        if (closeParen < 0) {
            return null;
        }
        List<StepValue> args = new Parser(text.substring(i + 1, closeParen)).parseArgs();
        int semicolon = findStatementEnd(text, closeParen + 1);
        if (semicolon < 0) {
            semicolon = closeParen;
        }
        String raw = text.substring(startIndex, Math.min(text.length(), semicolon + 1));
        return new StepInstance(id, typeUpper, args, raw);
    }

    private static int cursorSkipWs(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int indexOfIgnoreCase(String text, String needle, int fromIndex) {
        int limit = text.length() - needle.length();
        for (int i = Math.max(0, fromIndex); i <= limit; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static int findMatchingParen(String text, int openParenIndex) {
        // 字符串内部可能出现括号/逗号/分号，因此需要 inString 状态跳过
        int depth = 0;
        boolean inString = false;
        for (int i = openParenIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }
            if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int findStatementEnd(String text, int fromIndex) {
        boolean inString = false;
        int depth = 0;
        for (int i = Math.max(0, fromIndex); i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }
            if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ';' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 参数表达式解析器：字符串、引用、列表、枚举、数字、带类型值、{@code $}、{@code *}。
     */
    private static final class Parser {
        final String text;
        int i = 0;

        Parser(String text) {
            this.text = text;
        }

        List<StepValue> parseArgs() {
            List<StepValue> out = new ArrayList<>();
            skipWs();
            while (!eof()) {
                out.add(parseValue());
                skipWs();
                if (peek() != ',') {
                    break;
                }
                i++;
                skipWs();
            }
            return out;
        }

        StepValue parseValue() {
            skipWs();
            if (eof()) {
                return new StepNull();
            }
            char c = peek();
            if (c == '$') {
                i++;
                return new StepNull();
            }
            if (c == '*') {
                i++;
                return new StepDerived();
            }
            if (c == '#') {
                i++;
                Integer id = parseInt();
                return (id == null) ? new StepNull() : new StepRef(id);
            }
            if (c == '\'') {
                return new StepString(parseString());
            }
            if (c == '(') {
                i++;
                return new StepList(parseUntilClose());
            }
            if (c == '.' && i + 1 < text.length() && Character.isLetter(text.charAt(i + 1))) {
                return new StepEnum(parseEnum());
            }
            if (Character.isLetter(c) || c == '_') {
                String ident = parseIdent().toUpperCase(Locale.ROOT);
                skipWs();
                if (peek() == '(') {
                    i++;
                    return new StepTyped(ident, parseUntilClose());
                }
                return new StepEnum(ident);
            }
            if (c == '+' || c == '-' || c == '.' || Character.isDigit(c)) {
                return parseNumber();
            }
            i++;
            return new StepNull();
        }

        List<StepValue> parseUntilClose() {
            List<StepValue> items = new ArrayList<>();
            skipWs();
            if (peek() == ')') {
                i++;
                return items;
            }
            while (!eof()) {
                items.add(parseValue());
                skipWs();
                if (peek() == ',') {
                    i++;
                    continue;
                }
                if (peek() == ')') {
                    i++;
                }
                break;
            }
            return items;
        }

        StepNumber parseNumber() {
            int start = i;
            while (!eof()) {
                char c = peek();
                if (Character.isDigit(c) || c == '+' || c == '-' || c == '.' || c == 'E' || c == 'e' || c == 'D' || c == 'd') {
                    i++;
                    continue;
                }
                break;
            }
            String raw = text.substring(start, i);
            Double v = null;
            try {
                v = Double.parseDouble(raw.replace('D', 'E').replace('d', 'E'));
            } catch (NumberFormatException ignored) {
                // 非法数字保留原文，value 为 null 供调用方判断
            }
            return new StepNumber(raw, v);
        }

        String parseEnum() {
            // .NAME. -> NAME
            int start = ++i;
            while (!eof() && peek() != '.') {
                i++;
            }
            String value = text.substring(start, i);
            if (!eof()) {
                i++;
            }
            return value.toUpperCase(Locale.ROOT);
        }

        String parseIdent() {
            int start = i;
            i++;
            while (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                i++;
            }
            return text.substring(start, i);
        }

        String parseString() {
            i++;
            StringBuilder raw = new StringBuilder();
            while (!eof()) {
                char c = peek();
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        raw.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                raw.append(c);
                i++;
            }
            if (!eof()) {
                i++;
            }
            return StepStrings.decode(raw.toString());
        }

        Integer parseInt() {
            int start = i;
            int v = 0;
            while (!eof() && Character.isDigit(peek())) {
                v = v * 10 + (peek() - '0');
                i++;
            }
            return i == start ? null : v;
        }

        void skipWs() {
            while (!eof() && Character.isWhitespace(peek())) {
                i++;
            }
        }

        boolean eof() {
            return i >= text.length();
        }

        char peek() {
            return eof() ? '\0' : text.charAt(i);
        }
    }
}
