package sa.com.cloudsolutions.lowering.instrumentation;

/**
 * One instrumentation policy, ready to be stacked on top of whatever instrumenter comes before it.
 */
@FunctionalInterface
public interface InstrumentationLayer {

    CompoundInstrumenter wrap(Instrumenter previous);

    /**
     * @param outer the layer that should run on the results of this one
     * @return a layer that applies this layer first and then {@code outer}
     */
    default InstrumentationLayer andThen(InstrumentationLayer outer) {
        return previous -> outer.wrap(wrap(previous));
    }
}
