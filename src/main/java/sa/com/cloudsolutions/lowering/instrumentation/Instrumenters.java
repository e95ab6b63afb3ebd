package sa.com.cloudsolutions.lowering.instrumentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.lowering.configuration.Settings;
import sa.com.cloudsolutions.lowering.exception.InstrumentationException;
import sa.com.cloudsolutions.lowering.lowering.SyntheticNodeFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Assembles chains of instrumenters.
 */
public class Instrumenters {
    private static final Logger logger = LoggerFactory.getLogger(Instrumenters.class);

    public static final String DEBUG_INFO = "debug_info";
    public static final String COVERAGE = "coverage";

    private Instrumenters() {}

    /**
     * Stack the layers on top of {@link Instrumenter#NO_OP}.
     * @param layers the layers, innermost first. The first layer's transformation is applied first.
     * @return the outermost instrumenter, or NO_OP when there are no layers
     */
    public static Instrumenter chain(List<InstrumentationLayer> layers) {
        Instrumenter instrumenter = Instrumenter.NO_OP;
        for (InstrumentationLayer layer : layers) {
            CompoundInstrumenter link = layer.wrap(instrumenter);
            logger.debug("Chained {} on top of {}", link.getClass().getSimpleName(), instrumenter.getClass().getSimpleName());
            instrumenter = link;
        }
        return instrumenter;
    }

    public static Instrumenter chain(InstrumentationLayer... layers) {
        return chain(Arrays.asList(layers));
    }

    /**
     * Build the chain named by the {@code instrumentation.policies} setting for one lowering run.
     * @param factory the node factory of the lowering run, used by policies that keep per run state
     * @return the outermost instrumenter
     * @throws InstrumentationException if the settings were not loaded or a policy name is not known
     */
    public static Instrumenter fromSettings(SyntheticNodeFactory factory) {
        if (!Settings.isLoaded()) {
            throw new InstrumentationException("Settings have not been loaded");
        }
        List<InstrumentationLayer> layers = new ArrayList<>();
        for (String policy : Settings.getPolicies()) {
            layers.add(layerFor(policy, factory));
        }
        logger.info("Instrumenting {} with {}", factory.getCurrentMethod(), Settings.getPolicies());
        return chain(layers);
    }

    private static InstrumentationLayer layerFor(String policy, SyntheticNodeFactory factory) {
        switch (policy) {
            case DEBUG_INFO:
                return DebugInfoInjector.layer(new SequencePoints(Settings.getSequencePointType()));
            case COVERAGE:
                return CoverageInstrumenter.layer(factory, Settings.getCoveragePayload());
            default:
                throw new InstrumentationException("Unknown instrumentation policy " + policy);
        }
    }

    /**
     * Find a link of the given type in a chain.
     * @param instrumenter the outermost instrumenter of the chain
     * @param type the kind of instrumenter being looked for
     * @return the outermost link of that type
     */
    public static <T extends Instrumenter> Optional<T> find(Instrumenter instrumenter, Class<T> type) {
        Instrumenter current = instrumenter;
        while (current != null) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = current instanceof CompoundInstrumenter compound ? compound.getPrevious() : null;
        }
        return Optional.empty();
    }
}
