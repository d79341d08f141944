package io.formulaxform.core.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The value built by the comma operator. A call spreads an {@code Arguments} value into positional
 * arguments; any other value, a plain {@link List} included, is passed as one argument.
 *
 * <p>Immutable.
 */
public final class Arguments extends AbstractList<Object> {

    /** The argument list of a call written as {@code f()}. */
    public static final Arguments EMPTY = new Arguments(List.of());

    private final List<Object> items;

    private Arguments(List<Object> items) {
        this.items = items;
    }

    public static Arguments of(Object... values) {
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))));
    }

    /**
     * Appends {@code right} to {@code left}. If {@code left} is not yet an {@code Arguments} value it
     * becomes the first element, so {@code a, b, c} builds {@code [a, b, c]}.
     */
    public static Arguments append(Object left, Object right) {
        List<Object> out = new ArrayList<>();
        if (left instanceof Arguments args) {
            out.addAll(args.items);
        } else {
            out.add(left);
        }
        out.add(right);
        return new Arguments(Collections.unmodifiableList(out));
    }

    /** The positional arguments a call receives for {@code value}. */
    public static List<Object> spread(Object value) {
        if (value instanceof Arguments args) {
            return args.items;
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return Collections.unmodifiableList(single);
    }

    @Override
    public Object get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }
}
