package sa.com.cloudsolutions.lowering.instrumentation;

import com.github.javaparser.ast.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.lowering.bound.BoundBreakStatement;
import sa.com.cloudsolutions.lowering.bound.BoundContinueStatement;
import sa.com.cloudsolutions.lowering.bound.BoundExpressionStatement;
import sa.com.cloudsolutions.lowering.bound.BoundGotoStatement;
import sa.com.cloudsolutions.lowering.bound.BoundIfStatement;
import sa.com.cloudsolutions.lowering.bound.BoundLabeledStatement;
import sa.com.cloudsolutions.lowering.bound.BoundLocalDeclaration;
import sa.com.cloudsolutions.lowering.bound.BoundLockStatement;
import sa.com.cloudsolutions.lowering.bound.BoundReturnStatement;
import sa.com.cloudsolutions.lowering.bound.BoundStatement;
import sa.com.cloudsolutions.lowering.bound.BoundSwitchStatement;
import sa.com.cloudsolutions.lowering.bound.BoundThrowStatement;
import sa.com.cloudsolutions.lowering.bound.BoundUsingStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldBreakStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldReturnStatement;
import sa.com.cloudsolutions.lowering.lowering.SyntheticNodeFactory;

/**
 * Records which statements of a method were executed.
 *
 * Every user written statement that reaches one of the overridden hooks is prefixed with
 * {@code payload[slot]++;} and the statement's syntax is remembered in {@link CoverageSpans}
 * under that slot. Compiler generated statements are left alone.
 *
 * An instance accumulates slots, so it belongs to a single lowering run.
 */
public class CoverageInstrumenter extends CompoundInstrumenter {
    private static final Logger logger = LoggerFactory.getLogger(CoverageInstrumenter.class);
    public static final String DEFAULT_PAYLOAD = "$coverage";

    private final SyntheticNodeFactory factory;
    private final String payload;
    private final CoverageSpans spans;

    public CoverageInstrumenter(Instrumenter previous, SyntheticNodeFactory factory, String payload) {
        super(previous);
        this.factory = factory;
        this.payload = payload;
        this.spans = new CoverageSpans(factory.getCurrentMethod());
    }

    public static InstrumentationLayer layer(SyntheticNodeFactory factory, String payload) {
        return previous -> new CoverageInstrumenter(previous, factory, payload);
    }

    public CoverageSpans getSpans() {
        return spans;
    }

    public String getPayload() {
        return payload;
    }

    private Statement addAnalysis(BoundStatement original, Statement rewritten) {
        if (original.wasCompilerGenerated()) {
            return rewritten;
        }
        int slot = spans.add(original.getSyntax());
        logger.debug("Coverage slot {} of {} for {}", slot, spans.getMethod(), original.getSyntax().getKind());

        Statement count = factory.expressionStatement(factory.increment(factory.arrayElement(payload, slot)));
        return factory.statementList(count, rewritten);
    }

    @Override
    public Statement instrumentBreakStatement(BoundBreakStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentBreakStatement(original, rewritten));
    }

    @Override
    public Statement instrumentContinueStatement(BoundContinueStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentContinueStatement(original, rewritten));
    }

    @Override
    public Statement instrumentExpressionStatement(BoundExpressionStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentExpressionStatement(original, rewritten));
    }

    @Override
    public Statement instrumentFieldOrPropertyInitializer(BoundExpressionStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentFieldOrPropertyInitializer(original, rewritten));
    }

    @Override
    public Statement instrumentGotoStatement(BoundGotoStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentGotoStatement(original, rewritten));
    }

    @Override
    public Statement instrumentIfStatement(BoundIfStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentIfStatement(original, rewritten));
    }

    @Override
    public Statement instrumentLabelStatement(BoundLabeledStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentLabelStatement(original, rewritten));
    }

    @Override
    public Statement instrumentLocalInitialization(BoundLocalDeclaration original, Statement rewritten) {
        return addAnalysis(original, super.instrumentLocalInitialization(original, rewritten));
    }

    @Override
    public Statement instrumentLockTargetCapture(BoundLockStatement original, Statement lockTargetCapture) {
        return addAnalysis(original, super.instrumentLockTargetCapture(original, lockTargetCapture));
    }

    @Override
    public Statement instrumentReturnStatement(BoundReturnStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentReturnStatement(original, rewritten));
    }

    @Override
    public Statement instrumentSwitchStatement(BoundSwitchStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentSwitchStatement(original, rewritten));
    }

    @Override
    public Statement instrumentThrowStatement(BoundThrowStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentThrowStatement(original, rewritten));
    }

    @Override
    public Statement instrumentUsingTargetCapture(BoundUsingStatement original, Statement usingTargetCapture) {
        return addAnalysis(original, super.instrumentUsingTargetCapture(original, usingTargetCapture));
    }

    @Override
    public Statement instrumentYieldBreakStatement(BoundYieldBreakStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentYieldBreakStatement(original, rewritten));
    }

    @Override
    public Statement instrumentYieldReturnStatement(BoundYieldReturnStatement original, Statement rewritten) {
        return addAnalysis(original, super.instrumentYieldReturnStatement(original, rewritten));
    }
}
