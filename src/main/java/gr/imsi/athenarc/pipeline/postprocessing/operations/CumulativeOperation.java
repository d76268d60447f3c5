package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Running sum, product, minimum or maximum down each source column of
 * {@code columns {source: destination}}. Null cells stay null and do not reset
 * the running value. Integer columns stay integer.
 */
public class CumulativeOperation extends AbstractPostProcessor {

    public static final String KIND = "cum";

    enum Operator {
        SUM,
        PROD,
        MIN,
        MAX;

        double combine(double acc, double value) {
            switch (this) {
                case SUM:
                    return acc + value;
                case PROD:
                    return acc * value;
                case MIN:
                    return Math.min(acc, value);
                default:
                    return Math.max(acc, value);
            }
        }

        long combine(long acc, long value) {
            switch (this) {
                case SUM:
                    return Math.addExact(acc, value);
                case PROD:
                    return Math.multiplyExact(acc, value);
                case MIN:
                    return Math.min(acc, value);
                default:
                    return Math.max(acc, value);
            }
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        Map<String, String> mapping = options.getColumnMapping("columns");
        String operatorName = options.getString("operator");
        Operator operator;
        try {
            operator = Operator.valueOf(operatorName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw options.malformed("operator", "one of sum, prod, min, max");
        }

        List<String> names = new ArrayList<>(input.getColumns());
        List<ColumnType> types = new ArrayList<>(input.getTypes());
        List<List<Object>> rows = new ArrayList<>();
        input.getRows().forEach(row -> rows.add(copy(row)));

        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            int source = column(input, entry.getKey());
            boolean integral = input.getTypes().get(source) == ColumnType.INTEGER;
            int target = RollingOperation.targetColumn(names, types, entry.getValue(),
                integral ? ColumnType.INTEGER : ColumnType.FLOAT);
            Long longAcc = null;
            Double doubleAcc = null;
            for (int i = 0; i < rows.size(); i++) {
                Object raw = input.getRows().get(i).get(source);
                Object value = null;
                if (raw != null && integral) {
                    long current = ((Number) raw).longValue();
                    longAcc = longAcc == null ? current : operator.combine(longAcc, current);
                    value = longAcc;
                } else if (raw != null) {
                    double current = number(raw, entry.getKey());
                    doubleAcc = doubleAcc == null ? current : operator.combine(doubleAcc, current);
                    value = doubleAcc;
                }
                RollingOperation.setOrAppend(rows.get(i), target, value);
            }
        }
        return new TabularResult(names, types, rows);
    }
}
