package io.opscan.engine;

import io.opscan.config.AnalyzerConfig;
import io.opscan.operation.Operation;
import io.opscan.operation.OperationKind;
import io.opscan.operation.Operations;
import io.opscan.rules.AnalysisRule;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.EvaluationContext;
import io.opscan.rules.GeneratedCodeMode;
import io.opscan.rules.RuleDescriptor;
import io.opscan.rules.RuleEvaluator;
import io.opscan.rules.RuleRegistry;
import io.opscan.semantics.Compilation;
import io.opscan.semantics.CompilationUnit;
import io.opscan.semantics.OperationBlock;
import io.opscan.semantics.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs rules over a compilation.
 * <p>
 * For each compilation:
 * <ol>
 *   <li>every enabled rule resolves its well-known types once; rules that cannot are inert</li>
 *   <li>every operation of every method body and field initializer is visited in pre-order</li>
 *   <li>each node is evaluated by the live rules registered for its kind, independently</li>
 * </ol>
 * Units may be analyzed in parallel; the diagnostic list is sorted so that the result does not
 * depend on scheduling. A failing evaluation is logged and skipped, never fatal.
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final RuleRegistry registry;
    private final AnalyzerConfig config;

    public AnalysisEngine(RuleRegistry registry, AnalyzerConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * A rule that is live for one compilation.
     */
    private record ActiveRule(AnalysisRule rule, RuleDescriptor descriptor, RuleEvaluator evaluator) {}

    private record UnitResult(List<Diagnostic> diagnostics, long nodesVisited, int failedEvaluations) {}

    public AnalysisResult analyze(Compilation compilation) {
        return analyze(compilation, new CancellationToken());
    }

    /**
     * Analyzes one compilation.
     *
     * @throws CancellationException if the token is cancelled; no partial result is produced
     */
    public AnalysisResult analyze(Compilation compilation, CancellationToken token) {
        Instant start = Instant.now();
        SemanticModel model = new SemanticModel(compilation);

        List<String> activeIds = new ArrayList<>();
        List<String> inertIds = new ArrayList<>();
        Map<OperationKind, List<ActiveRule>> rulesByKind = startRules(model, activeIds, inertIds);

        List<CompilationUnit> units = compilation.units().stream()
                .filter(unit -> {
                    boolean excluded = config.shouldExcludePath(unit.path());
                    if (excluded) {
                        log.debug("Skipping excluded unit {}", unit.path());
                    }
                    return !excluded;
                })
                .toList();

        List<UnitResult> unitResults = rulesByKind.isEmpty()
                ? List.of()
                : analyzeUnits(units, model, rulesByKind, token);

        List<Diagnostic> diagnostics = new ArrayList<>();
        long nodesVisited = 0;
        int failedEvaluations = 0;
        for (UnitResult unitResult : unitResults) {
            diagnostics.addAll(unitResult.diagnostics());
            nodesVisited += unitResult.nodesVisited();
            failedEvaluations += unitResult.failedEvaluations();
        }
        diagnostics.sort(Diagnostic.SOURCE_ORDER);

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Analyzed compilation '{}': {} units, {} nodes, {} diagnostics in {} ms",
                compilation.name(), units.size(), nodesVisited, diagnostics.size(), duration.toMillis());

        return new AnalysisResult(
                compilation.name(),
                diagnostics,
                activeIds,
                inertIds,
                units.size(),
                nodesVisited,
                failedEvaluations,
                duration);
    }

    private Map<OperationKind, List<ActiveRule>> startRules(SemanticModel model,
                                                            List<String> activeIds,
                                                            List<String> inertIds) {
        Map<OperationKind, List<ActiveRule>> rulesByKind = new EnumMap<>(OperationKind.class);

        for (AnalysisRule rule : registry.allRules()) {
            RuleDescriptor descriptor = rule.descriptor();
            if (rule.supportedDiagnostics().isEmpty() || !config.isRuleEnabled(descriptor)) {
                continue;
            }

            Optional<RuleEvaluator> evaluator = rule.onCompilationStart(model);
            if (evaluator.isEmpty()) {
                inertIds.add(descriptor.id());
                continue;
            }

            ActiveRule active = new ActiveRule(rule, config.effectiveDescriptor(descriptor), evaluator.get());
            for (OperationKind kind : rule.interestedInKinds()) {
                rulesByKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(active);
            }
            activeIds.add(descriptor.id());
        }
        return rulesByKind;
    }

    private List<UnitResult> analyzeUnits(List<CompilationUnit> units, SemanticModel model,
                                          Map<OperationKind, List<ActiveRule>> rulesByKind,
                                          CancellationToken token) {
        int threads = Math.min(config.parallelism(), units.size());
        if (threads <= 1) {
            List<UnitResult> results = new ArrayList<>(units.size());
            for (CompilationUnit unit : units) {
                results.add(analyzeUnit(unit, model, rulesByKind, token));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<UnitResult>> futures = new ArrayList<>(units.size());
            for (CompilationUnit unit : units) {
                futures.add(executor.submit(() -> analyzeUnit(unit, model, rulesByKind, token)));
            }

            List<UnitResult> results = new ArrayList<>(units.size());
            for (Future<UnitResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new CancellationException("Analysis interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Unit analysis failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private UnitResult analyzeUnit(CompilationUnit unit, SemanticModel model,
                                   Map<OperationKind, List<ActiveRule>> rulesByKind,
                                   CancellationToken token) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        long nodesVisited = 0;
        int failedEvaluations = 0;

        for (OperationBlock block : unit.blocks()) {
            for (Operation node : Operations.descendantsAndSelf(block.root())) {
                nodesVisited++;
                List<ActiveRule> candidates = rulesByKind.get(node.kind());
                if (candidates == null) {
                    continue;
                }

                for (ActiveRule active : candidates) {
                    if (unit.generated() && active.rule().generatedCodeMode() == GeneratedCodeMode.SKIP) {
                        continue;
                    }
                    token.throwIfCancellationRequested();

                    EvaluationContext context = new EvaluationContext(model, unit, block, active.descriptor());
                    try {
                        active.evaluator().evaluate(node, context).ifPresent(diagnostics::add);
                    } catch (RuntimeException e) {
                        failedEvaluations++;
                        log.warn("{} failed on {} at {} in {}; skipping node",
                                active.descriptor().id(), node.kind(), context.locate(node.location()).display(),
                                block.owner(), e);
                    }
                }
            }
        }
        return new UnitResult(diagnostics, nodesVisited, failedEvaluations);
    }
}
