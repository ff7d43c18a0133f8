package io.splitdrive.sql.exec.expression;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Mapping between DuckDB type names and the arrow types DuckDB exports them as.
 */
public final class DuckTypes {

    private static final Pattern DECIMAL = Pattern.compile("DECIMAL\\((\\d+),\\s*(\\d+)\\)");

    private DuckTypes() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ArrowType toArrowType(String duckDbType) {
        var type = duckDbType.trim().toUpperCase(Locale.ROOT);
        var decimal = DECIMAL.matcher(type);
        if (decimal.matches()) {
            return new ArrowType.Decimal(Integer.parseInt(decimal.group(1)), Integer.parseInt(decimal.group(2)), 128);
        }
        return switch (type) {
            case "TINYINT" -> new ArrowType.Int(8, true);
            case "SMALLINT" -> new ArrowType.Int(16, true);
            case "INTEGER" -> new ArrowType.Int(32, true);
            case "BIGINT" -> new ArrowType.Int(64, true);
            case "FLOAT" -> new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
            case "DOUBLE" -> new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
            case "VARCHAR" -> new ArrowType.Utf8();
            case "BOOLEAN" -> new ArrowType.Bool();
            case "DATE" -> new ArrowType.Date(DateUnit.DAY);
            case "TIMESTAMP" -> new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
            default -> throw new ExpressionException("Unsupported DuckDB type: " + duckDbType);
        };
    }

    public static String toSqlType(ArrowType arrowType) {
        if (arrowType instanceof ArrowType.Int intType && intType.getIsSigned()) {
            return switch (intType.getBitWidth()) {
                case 8 -> "TINYINT";
                case 16 -> "SMALLINT";
                case 32 -> "INTEGER";
                case 64 -> "BIGINT";
                default -> throw new ExpressionException("Unsupported int width: " + intType.getBitWidth());
            };
        } else if (arrowType instanceof ArrowType.FloatingPoint floatingPoint) {
            return floatingPoint.getPrecision() == FloatingPointPrecision.DOUBLE ? "DOUBLE" : "FLOAT";
        } else if (arrowType instanceof ArrowType.Utf8) {
            return "VARCHAR";
        } else if (arrowType instanceof ArrowType.Bool) {
            return "BOOLEAN";
        } else if (arrowType instanceof ArrowType.Date) {
            return "DATE";
        } else if (arrowType instanceof ArrowType.Timestamp) {
            return "TIMESTAMP";
        } else if (arrowType instanceof ArrowType.Decimal decimal) {
            return "DECIMAL(%d,%d)".formatted(decimal.getPrecision(), decimal.getScale());
        }
        throw new ExpressionException("Unsupported arrow type: " + arrowType);
    }

    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    public static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
