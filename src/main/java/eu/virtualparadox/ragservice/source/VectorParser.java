package eu.virtualparadox.ragservice.source;

import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.SQLException;
import java.util.Collection;

/**
 * Normalizes the many shapes a stored embedding can take into a {@code float[]}.
 * <p>
 * Accepted inputs:
 * <ul>
 *   <li>typed arrays: {@code float[]}, {@code double[]}, {@code Number[]}, {@code Object[]}</li>
 *   <li>{@link java.sql.Array} and {@link Collection} of numbers</li>
 *   <li>text: {@code [0.1, 0.2]} (pgvector / JSON), {@code {0.1,0.2}} (SQL array literal), {@code (0.1,0.2)}</li>
 *   <li>any other driver object whose {@code toString()} is one of the text forms (pgvector {@code PGobject})</li>
 * </ul>
 * The parsed length must equal the dimension the producer declared for the row, and every value must be finite.
 */
@Component
public class VectorParser {

    /**
     * @param recordId          id of the row, used in error messages
     * @param raw               value as returned by the JDBC driver
     * @param declaredDimension dimension stored next to the vector
     * @return a fresh array of exactly {@code declaredDimension} finite values
     * @throws MalformedVectorException if the value cannot be parsed or has the wrong length
     */
    public float[] parse(final String recordId, final Object raw, final int declaredDimension) {
        final float[] vector = toFloats(recordId, raw);

        if (vector.length != declaredDimension) {
            throw new MalformedVectorException(recordId,
                    "expected " + declaredDimension + " values, got " + vector.length);
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new MalformedVectorException(recordId, "non-finite value at position " + i);
            }
        }
        return vector;
    }

    private float[] toFloats(final String recordId, final Object raw) {
        if (raw == null) {
            throw new MalformedVectorException(recordId, "vector is missing");
        }
        if (raw instanceof float[] floats) {
            return floats.clone();
        }
        if (raw instanceof double[] doubles) {
            final float[] out = new float[doubles.length];
            for (int i = 0; i < doubles.length; i++) {
                out[i] = (float) doubles[i];
            }
            return out;
        }
        if (raw instanceof Array sqlArray) {
            try {
                return toFloats(recordId, sqlArray.getArray());
            } catch (SQLException e) {
                throw new MalformedVectorException(recordId, "cannot read SQL array", e);
            }
        }
        if (raw instanceof Object[] objects) {
            return fromObjects(recordId, objects);
        }
        if (raw instanceof Collection<?> collection) {
            return fromObjects(recordId, collection.toArray());
        }
        return parseText(recordId, raw.toString());
    }

    private float[] fromObjects(final String recordId, final Object[] values) {
        final float[] out = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            final Object value = values[i];
            if (value instanceof Number number) {
                out[i] = number.floatValue();
            } else if (value != null) {
                out[i] = parseFloat(recordId, value.toString());
            } else {
                throw new MalformedVectorException(recordId, "null value at position " + i);
            }
        }
        return out;
    }

    private float[] parseText(final String recordId, final String text) {
        String body = text.trim();
        if (body.length() >= 2 && isOpening(body.charAt(0)) && isClosing(body.charAt(body.length() - 1))) {
            body = body.substring(1, body.length() - 1).trim();
        }
        if (body.isEmpty()) {
            return new float[0];
        }

        final String[] parts = body.split(",");
        final float[] out = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            out[i] = parseFloat(recordId, parts[i]);
        }
        return out;
    }

    private float parseFloat(final String recordId, final String token) {
        try {
            return Float.parseFloat(token.trim());
        } catch (NumberFormatException e) {
            throw new MalformedVectorException(recordId, "invalid number '" + token.trim() + "'", e);
        }
    }

    private boolean isOpening(final char c) {
        return c == '[' || c == '{' || c == '(';
    }

    private boolean isClosing(final char c) {
        return c == ']' || c == '}' || c == ')';
    }
}
