package com.questrail.junction.compiler;

import com.questrail.junction.api.CompilationResult;
import com.questrail.junction.api.JunctionConfig;
import com.questrail.junction.api.OutputRow;
import com.questrail.junction.api.RowOutcome;
import com.questrail.junction.api.TemplateCode;
import com.questrail.junction.api.TopologyException;
import com.questrail.junction.api.Transition;
import com.questrail.junction.config.JunctionCompilerConfig;
import com.questrail.junction.internal.classify.StageClassifier;
import com.questrail.junction.internal.template.TemplateSelector;
import com.questrail.junction.internal.topology.TopologyGraph;
import com.questrail.junction.observability.CompilationObservabilitySink;
import com.questrail.junction.observability.RowCompiledEvent;
import com.questrail.junction.observability.RowFailedEvent;
import com.questrail.junction.observability.TopologyRejectedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JunctionCompiler
 * =============================================================================
 * Compiles a {@link JunctionConfig} into one logic code per transition.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Validate the whole transition graph. A dead end raises
 *       {@link TopologyException} before any row exists.</li>
 *   <li>Build the {@link TopologyGraph} once.</li>
 *   <li>For each transition, in input order: classify both stages, select a
 *       template, assemble its fragments and render the logic code.</li>
 * </ol>
 *
 * <h2>Row isolation</h2>
 * A failure while compiling one transition is recorded as a
 * {@link RowOutcome.Failed} row. It never aborts the batch and never changes
 * any other row.
 *
 * <h2>Threading</h2>
 * A compile call is a single synchronous pass with no I/O. Instances hold no
 * mutable state and may be shared.
 */
public final class JunctionCompiler
{
    private static final Logger log = LoggerFactory.getLogger(JunctionCompiler.class);

    private final JunctionCompilerConfig compilerConfig;

    public JunctionCompiler() {
        this(JunctionCompilerConfig.defaults());
    }

    public JunctionCompiler(JunctionCompilerConfig compilerConfig) {
        this.compilerConfig = Objects.requireNonNull(compilerConfig, "compilerConfig");
    }

    /**
     * Compiles every transition of {@code junction}.
     *
     * @param junction the junction to compile (must not be {@code null})
     * @return rows in transition input order
     * @throws TopologyException if the transition graph contains a dead end
     */
    public CompilationResult compile(JunctionConfig junction) {
        Objects.requireNonNull(junction, "junction");
        CompilationObservabilitySink sink = compilerConfig.observabilitySink();

        List<Transition> transitions = junction.transitions();
        log.debug("Compiling junction: {} transitions, vehicle anchor {}, LRT anchor {}",
                transitions.size(), junction.vehicleAnchor(), junction.lrtAnchor());

        try {
            TopologyGraph.validate(transitions, junction.vehicleAnchor());
        } catch (TopologyException e) {
            sink.onTopologyRejected(new TopologyRejectedEvent(e.stage(), e.getMessage()));
            throw e;
        }

        StageClassifier classifier = new StageClassifier(junction.lrtAnchor());
        TopologyGraph graph = TopologyGraph.build(transitions, classifier);
        TransitionLogicAssembler assembler = new TransitionLogicAssembler(junction, graph, classifier);

        List<OutputRow> rows = new ArrayList<>(transitions.size());
        int sequence = compilerConfig.firstRowNumber();
        for (Transition transition : transitions) {
            rows.add(compileRow(sequence++, transition, classifier, assembler, sink));
        }

        CompilationResult result = new CompilationResult(rows);
        log.info("Compiled {} of {} transitions", result.compiledCount(), rows.size());
        return result;
    }

    private OutputRow compileRow(int sequence,
                                 Transition transition,
                                 StageClassifier classifier,
                                 TransitionLogicAssembler assembler,
                                 CompilationObservabilitySink sink) {
        String from = transition.from();
        String to = transition.to();
        TemplateCode template = null;

        try {
            template = TemplateSelector.select(
                    from, classifier.classify(from),
                    to, classifier.classify(to));
            String logicCode = assembler.assemble(template, transition);

            sink.onRowCompiled(new RowCompiledEvent(sequence, from, to, template));
            return new OutputRow(sequence, from, to, template, new RowOutcome.Compiled(logicCode));
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            sink.onRowFailed(new RowFailedEvent(sequence, from, to, template, message, e));
            return new OutputRow(sequence, from, to, template, new RowOutcome.Failed(message));
        }
    }
}
