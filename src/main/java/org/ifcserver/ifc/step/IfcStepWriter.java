package org.ifcserver.ifc.step;

import org.ifcserver.ifc.model.IfcEntity;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcModelHeader;
import org.ifcserver.ifc.model.StepValues;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * 把 {@link IfcModel} 写成 STEP 物理文件（ISO-10303-21）文本。
 * <p>
 * 结构：
 * <pre>
 * ISO-10303-21;
 * HEADER;
 * FILE_DESCRIPTION(...);
 * FILE_NAME(...);
 * FILE_SCHEMA(('IFC4'));
 * ENDSEC;
 * DATA;
 * #1=IFCPERSON(...);
 * ...
 * ENDSEC;
 * END-ISO-10303-21;
 * </pre>
 * 实例按注册顺序输出，引用写为 {@code #label}。引用了未注册实体时抛出 {@link IllegalStateException}。
 */
public final class IfcStepWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private IfcStepWriter() {
    }

    public static String write(IfcModel model) {
        return write(model, Instant.now());
    }

    public static String write(IfcModel model, Instant timestamp) {
        // 整个写出过程持有读锁，保证输出的是某一次提交后的一致快照
        return model.read(m -> {
            StringBuilder out = new StringBuilder(4096 + m.size() * 96);
            out.append("ISO-10303-21;\n");
            writeHeader(out, m, timestamp);
            out.append("DATA;\n");
            for (IfcEntity entity : m.instances()) {
                out.append('#').append(m.labelOf(entity)).append('=').append(entity.stepType()).append('(');
                writeArguments(out, m, entity.stepArguments());
                out.append(");\n");
            }
            out.append("ENDSEC;\n");
            out.append("END-ISO-10303-21;\n");
            return out.toString();
        });
    }

    private static void writeHeader(StringBuilder out, IfcModel model, Instant timestamp) {
        IfcModelHeader header = model.getHeader();
        out.append("HEADER;\n");

        out.append("FILE_DESCRIPTION(");
        writeStringList(out, header.fileDescriptions());
        out.append(',');
        writeString(out, header.implementationLevel());
        out.append(");\n");

        // FILE_NAME(name, time_stamp, author, organization, preprocessor_version, originating_system, authorization)
        out.append("FILE_NAME(");
        writeString(out, model.getFileName());
        out.append(',');
        writeString(out, TIMESTAMP.format(timestamp.truncatedTo(ChronoUnit.SECONDS)));
        out.append(',');
        writeStringList(out, header.authors());
        out.append(',');
        writeStringList(out, header.organizations());
        out.append(',');
        writeString(out, header.preprocessorVersion());
        out.append(',');
        writeString(out, header.originatingSystem());
        out.append(',');
        writeString(out, header.authorization());
        out.append(");\n");

        out.append("FILE_SCHEMA((");
        writeString(out, header.schema());
        out.append("));\n");
        out.append("ENDSEC;\n");
    }

    private static void writeStringList(StringBuilder out, List<String> values) {
        out.append('(');
        if (values.isEmpty()) {
            // 头部列表不允许为空聚合，用空字符串占位
            out.append("''");
        }
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            writeString(out, values.get(i));
        }
        out.append(')');
    }

    private static void writeString(StringBuilder out, String value) {
        out.append('\'').append(value == null ? "" : StepStrings.encode(value)).append('\'');
    }

    private static void writeArguments(StringBuilder out, IfcModel model, List<?> args) {
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            writeValue(out, model, args.get(i));
        }
    }

    private static void writeValue(StringBuilder out, IfcModel model, Object value) {
        if (value == null) {
            out.append('$');
        } else if (value == StepValues.DERIVED) {
            out.append('*');
        } else if (value instanceof String s) {
            writeString(out, s);
        } else if (value instanceof Double d) {
            out.append(formatReal(d));
        } else if (value instanceof Float f) {
            out.append(formatReal(f.doubleValue()));
        } else if (value instanceof Integer || value instanceof Long) {
            out.append(value);
        } else if (value instanceof Boolean b) {
            out.append(b ? ".T." : ".F.");
        } else if (value instanceof Enum<?> e) {
            out.append('.').append(e.name()).append('.');
        } else if (value instanceof IfcEntity entity) {
            int label = model.labelOf(entity);
            if (label < 0) {
                throw new IllegalStateException("引用了未注册到模型的实体：" + entity.stepType());
            }
            out.append('#').append(label);
        } else if (value instanceof List<?> list) {
            out.append('(');
            writeArguments(out, model, list);
            out.append(')');
        } else if (value instanceof StepValues.Typed typed) {
            out.append(typed.typeName().toUpperCase(Locale.ROOT)).append('(');
            writeValue(out, model, typed.value());
            out.append(')');
        } else {
            throw new IllegalArgumentException("不支持的 STEP 参数类型：" + value.getClass().getName());
        }
    }

    /**
     * STEP 实数必须带小数点：{@code 10.0 -> "10."}，{@code 1.0E-5 -> "1.E-05"}。
     * 非有限值没有合法的 STEP 表示，写为 {@code $} 并由校验报告指出。
     */
    static String formatReal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "$";
        }
        if (value == 0.0) {
            return "0.";
        }
        String text = Double.toString(value);
        int exp = text.indexOf('E');
        String mantissa = exp < 0 ? text : text.substring(0, exp);
        String exponent = exp < 0 ? "" : text.substring(exp + 1);

        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 1);
        }
        if (exponent.isEmpty()) {
            return mantissa;
        }
        boolean negative = exponent.startsWith("-");
        String digits = negative ? exponent.substring(1) : exponent;
        if (digits.length() < 2) {
            digits = "0" + digits;
        }
        return mantissa + "E" + (negative ? "-" : "") + digits;
    }
}
