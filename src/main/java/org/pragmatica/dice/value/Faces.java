package org.pragmatica.dice.value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An explicit list of die face values, as written in {@code 1d[1,3,5]} or implied by the fudge die {@code F}.
 */
public record Faces(List<Scalar> values) implements Value {
    public static final Faces FUDGE = new Faces(List.of(Scalar.of(-1), Scalar.ZERO, Scalar.ONE));

    public Faces {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A die needs at least one face.");
        }
        values = List.copyOf(values);
    }

    public static Faces of(double... values) {
        var list = new ArrayList<Scalar>(values.length);
        for (var value : values) {
            list.add(Scalar.of(value));
        }
        return new Faces(list);
    }

    @Override
    public Scalar total() {
        return Scalar.sum(values);
    }

    @Override
    public String toString() {
        if (values.size() == 1) {
            return "(" + values.get(0) + ",)";
        }
        return values.stream()
                     .map(Scalar::toString)
                     .collect(Collectors.joining(", ", "(", ")"));
    }
}
