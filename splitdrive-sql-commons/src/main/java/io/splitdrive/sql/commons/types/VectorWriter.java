package io.splitdrive.sql.commons.types;

import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;

import java.nio.charset.StandardCharsets;

public interface VectorWriter<V> {
    void write(V vector, int index, Object value);

    class VarCharVectorWriter implements VectorWriter<VarCharVector> {
        @Override
        public void write(VarCharVector varCharVector, int index, Object value) {
            if (value == null) {
                varCharVector.setNull(index);
                return;
            }
            var v = value.toString();
            varCharVector.setSafe(index, v.getBytes(StandardCharsets.UTF_8));
        }
    }

    class IntVectorWriter implements VectorWriter<IntVector> {
        @Override
        public void write(IntVector intVector, int index, Object value) {
            if (value == null) {
                intVector.setNull(index);
                return;
            }
            var v = (Number) value;
            intVector.setSafe(index, v.intValue());
        }
    }

    class BigIntVectorWriter implements VectorWriter<BigIntVector> {
        @Override
        public void write(BigIntVector bigIntVector, int index, Object value) {
            if (value == null) {
                bigIntVector.setNull(index);
                return;
            }
            var v = (Number) value;
            bigIntVector.setSafe(index, v.longValue());
        }
    }

    class FloatVectorWriter implements VectorWriter<Float8Vector> {
        @Override
        public void write(Float8Vector float8Vector, int index, Object value) {
            if (value == null) {
                float8Vector.setNull(index);
                return;
            }
            var v = (Number) value;
            float8Vector.setSafe(index, v.doubleValue());
        }
    }

    class BitVectorWriter implements VectorWriter<BitVector> {
        @Override
        public void write(BitVector bitVector, int index, Object value) {
            if (value == null) {
                bitVector.setNull(index);
                return;
            }
            bitVector.setSafe(index, (Boolean) value ? 1 : 0);
        }
    }
}
