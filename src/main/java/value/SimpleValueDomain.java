package value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.SplittableRandom;

public class SimpleValueDomain implements ValueDomain {

    public static final SimpleValueDomain INSTANCE = new SimpleValueDomain();

    @Override
    public ConcreteValue ofBoolean(boolean b) {
        return SimpleValue.ofBoolean(b);
    }

    @Override
    public ConcreteValue randomValue(Kind kind, SplittableRandom rng) {
        switch (kind.getFamily()) {
            case BOOL:
                return SimpleValue.ofBoolean(rng.nextBoolean());
            case BOUNDED:
                return SimpleValue.ofInteger(kind, randomBits(kind.getWidth(), rng));
            case UNBOUNDED:
                return SimpleValue.ofInteger(kind, rng.nextLong());
            case REAL:
                return SimpleValue.ofReal(BigDecimal.valueOf(rng.nextLong(), rng.nextInt(0, 8)));
            case FLOAT:
                return SimpleValue.ofFloat(Float.intBitsToFloat(rng.nextInt()));
            case DOUBLE:
                return SimpleValue.ofDouble(Double.longBitsToDouble(rng.nextLong()));
            default:
                List<String> members = kind.getEnumValues();
                if (members == null || members.isEmpty()) {
                    throw new IllegalArgumentException("Cannot draw a value of uninterpreted sort " + kind);
                }
                return SimpleValue.ofEnum(kind, members.get(rng.nextInt(members.size())));
        }
    }

    private static BigInteger randomBits(int width, SplittableRandom rng) {
        BigInteger r = BigInteger.ZERO;
        for (int done = 0; done < width; done += 32) {
            r = r.shiftLeft(32).or(BigInteger.valueOf(rng.nextInt() & 0xffffffffL));
        }
        return r;
    }
}
