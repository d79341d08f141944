package io.formulaxform.core.model;

import java.util.List;

/**
 * A function value callable from a formula. Receives its arguments positionally; a call such as
 * {@code f(a, b)} arrives as a two-element list, {@code f()} as an empty one.
 */
@FunctionalInterface
public interface Invocable {

    Object invoke(List<Object> args);
}
