package com.sievesql.compiler;

import com.sievesql.space.Code;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Distinct values of the kernel codes over the rows of the kid
 * ({@code GROUP BY}).
 */
public final class ProjectionTerm extends UnaryTerm {

    private final List<Code> kernels;

    public ProjectionTerm(int tag, Term kid, List<Code> kernels, Space space, Space baseline,
                          Map<Unit, Integer> routes) {
        super(tag, kid, space, baseline, routes);
        this.kernels = List.copyOf(kernels);
    }

    public List<Code> kernels() {
        return kernels;
    }

    @Override
    public String toString() {
        if (kernels.isEmpty()) {
            return "(" + kid() + " ^)";
        }
        return "(" + kid() + " ^ " + kernels.stream().map(Code::toString).collect(Collectors.joining(", ")) + ")";
    }
}
