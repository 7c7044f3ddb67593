package com.voiceflow.infrastructure.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceflow.domain.workflow.model.BrowserEvent;
import com.voiceflow.domain.workflow.model.CorrelationResult;
import com.voiceflow.domain.workflow.model.EnhancedWorkflowStep;
import com.voiceflow.domain.workflow.model.IntentAnalysisResult;
import com.voiceflow.domain.workflow.model.StepRefinement;
import com.voiceflow.domain.workflow.model.VoiceContext;
import com.voiceflow.domain.workflow.model.VoiceEvent;
import com.voiceflow.domain.workflow.model.WorkflowDocument;
import com.voiceflow.domain.workflow.model.WorkflowMetadata;
import com.voiceflow.infrastructure.ai.LanguageModelClient;
import com.voiceflow.infrastructure.intent.IntentAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns correlation results into a voice-enhanced workflow document.
 *
 * Steps:
 * 1. One base step per correlation, in input order
 * 2. Steps with voice context: intent analysis, then language-model refinement
 *    (concurrent, each call bounded by the refinement timeout from the moment it starts)
 * 3. Failed or timed-out refinement → rule-based enrichment of that step only
 * 4. Aggregate variables and conditions, assemble the document
 */
@Slf4j
public class EnhancedWorkflowGenerator {

    public static final Duration DEFAULT_REFINEMENT_TIMEOUT = Duration.ofSeconds(30);

    private final IntentAnalyzer intentAnalyzer;
    private final StepRefinementService refinementService;
    private final RuleBasedStepEnricher ruleBasedEnricher;
    private final WorkflowAggregator aggregator;
    private final Executor executor;
    private final Duration refinementTimeout;

    public EnhancedWorkflowGenerator(LanguageModelClient languageModelClient) {
        this(languageModelClient, new IntentAnalyzer(), new ObjectMapper(),
                ForkJoinPool.commonPool(), DEFAULT_REFINEMENT_TIMEOUT);
    }

    public EnhancedWorkflowGenerator(LanguageModelClient languageModelClient,
                                     IntentAnalyzer intentAnalyzer,
                                     ObjectMapper objectMapper,
                                     Executor executor,
                                     Duration refinementTimeout) {
        if (languageModelClient == null) {
            throw new IllegalArgumentException("A language model client must be provided");
        }
        if (refinementTimeout == null || refinementTimeout.isNegative() || refinementTimeout.isZero()) {
            throw new IllegalArgumentException("Refinement timeout must be positive");
        }
        this.intentAnalyzer = intentAnalyzer;
        this.refinementService = new StepRefinementService(languageModelClient, new StepPromptBuilder(), objectMapper);
        this.ruleBasedEnricher = new RuleBasedStepEnricher();
        this.aggregator = new WorkflowAggregator();
        this.executor = executor;
        this.refinementTimeout = refinementTimeout;
    }

    public CompletableFuture<WorkflowDocument> generate(List<CorrelationResult> correlations, String goalDescription) {
        log.info("[WorkflowGenerator] Generating workflow from {} correlations", correlations.size());

        List<EnhancedWorkflowStep> baseSteps = buildBaseSteps(correlations);

        List<CompletableFuture<EnhancedWorkflowStep>> stepFutures = new ArrayList<>(baseSteps.size());
        for (int i = 0; i < baseSteps.size(); i++) {
            stepFutures.add(enhanceStep(baseSteps.get(i), correlations.get(i)));
        }

        return CompletableFuture.allOf(stepFutures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<EnhancedWorkflowStep> steps = stepFutures.stream()
                            .map(CompletableFuture::join)
                            .toList();
                    return assemble(steps, correlations, goalDescription);
                });
    }

    List<EnhancedWorkflowStep> buildBaseSteps(List<CorrelationResult> correlations) {
        List<EnhancedWorkflowStep> steps = new ArrayList<>(correlations.size());
        for (int i = 0; i < correlations.size(); i++) {
            BrowserEvent event = correlations.get(i).browserEvent();
            steps.add(EnhancedWorkflowStep.builder()
                    .id("step_" + (i + 1))
                    .type(event.type())
                    .action(actionFor(event.type()))
                    .target(event.elementTag())
                    .value(event.value())
                    .xpath(event.xpath())
                    .cssSelector(event.cssSelector())
                    .enhanced(false)
                    .build());
        }
        return steps;
    }

    static String actionFor(String eventType) {
        if (eventType == null) {
            return "perform_action";
        }
        return switch (eventType) {
            case "click" -> "click_element";
            case "input" -> "input_text";
            case "navigation" -> "navigate_to";
            case "scroll" -> "scroll_page";
            case "select" -> "select_option";
            case "hover" -> "hover_element";
            default -> "perform_action";
        };
    }

    private CompletableFuture<EnhancedWorkflowStep> enhanceStep(EnhancedWorkflowStep step,
                                                                CorrelationResult correlation) {
        if (!correlation.hasVoiceEvents()) {
            return CompletableFuture.completedFuture(step);
        }

        List<String> voiceTexts = correlation.voiceEvents().stream()
                .map(VoiceEvent::text)
                .toList();
        List<IntentAnalysisResult> analyses = intentAnalyzer.batchAnalyze(voiceTexts);

        return refineWithDeadline(step, voiceTexts, analyses)
                .exceptionally(e -> StepRefinement.failure(e.getMessage()))
                .thenApply(refinement -> applyRefinement(step, voiceTexts, analyses, refinement));
    }

    /**
     * Runs one refinement call on the executor. The deadline starts when the call starts running,
     * so time spent queued behind sibling steps does not count. On expiry the step completes as a
     * failure and the worker running the call is interrupted.
     */
    private CompletableFuture<StepRefinement> refineWithDeadline(EnhancedWorkflowStep step, List<String> voiceTexts,
                                                                 List<IntentAnalysisResult> analyses) {
        CompletableFuture<StepRefinement> result = new CompletableFuture<>();
        long timeoutMillis = refinementTimeout.toMillis();

        executor.execute(() -> {
            Thread worker = Thread.currentThread();
            Object callLock = new Object();
            AtomicBoolean running = new AtomicBoolean(true);
            AtomicBoolean interruptedByDeadline = new AtomicBoolean(false);

            CompletableFuture<Void> deadline = CompletableFuture.runAsync(() -> {
                synchronized (callLock) {
                    if (running.get() && result.complete(
                            StepRefinement.failure("timed out after " + timeoutMillis + "ms"))) {
                        log.warn("[WorkflowGenerator] {} refinement timed out after {}ms, interrupting call",
                                step.getId(), timeoutMillis);
                        interruptedByDeadline.set(true);
                        worker.interrupt();
                    }
                }
            }, CompletableFuture.delayedExecutor(timeoutMillis, TimeUnit.MILLISECONDS));

            try {
                result.complete(refinementService.refine(step, voiceTexts, analyses));
            } catch (RuntimeException e) {
                result.complete(StepRefinement.failure(e.getMessage()));
            } finally {
                synchronized (callLock) {
                    running.set(false);
                    deadline.cancel(false);
                    if (interruptedByDeadline.get()) {
                        // clear the deadline interrupt before the worker takes its next task
                        Thread.interrupted();
                    }
                }
            }
        });
        return result;
    }

    private EnhancedWorkflowStep applyRefinement(EnhancedWorkflowStep step, List<String> voiceTexts,
                                                 List<IntentAnalysisResult> analyses, StepRefinement refinement) {
        if (!refinement.success()) {
            log.warn("[WorkflowGenerator] {} refinement failed, using rule-based enrichment: {}",
                    step.getId(), refinement.failureReason());
            return ruleBasedEnricher.enrich(step, voiceTexts, analyses);
        }

        String action = refinement.enhancedAction() == null || refinement.enhancedAction().isBlank()
                ? step.getAction()
                : refinement.enhancedAction();

        VoiceContext voiceContext = new VoiceContext(
                List.copyOf(voiceTexts),
                RuleBasedStepEnricher.intentLabels(analyses),
                refinement.errorHandling(),
                refinement.smartSelectors());

        return step.toBuilder()
                .action(action)
                .conditions(refinement.conditions())
                .extractedVariables(refinement.variables())
                .voiceContext(voiceContext)
                .enhanced(true)
                .build();
    }

    private WorkflowDocument assemble(List<EnhancedWorkflowStep> steps, List<CorrelationResult> correlations,
                                      String goalDescription) {
        int voiceEventsCount = correlations.stream()
                .mapToInt(c -> c.voiceEvents() == null ? 0 : c.voiceEvents().size())
                .sum();

        String description = goalDescription == null || goalDescription.isBlank()
                ? WorkflowDocument.DEFAULT_DESCRIPTION
                : goalDescription;

        long enhancedCount = steps.stream().filter(EnhancedWorkflowStep::isEnhanced).count();
        log.info("[WorkflowGenerator] Workflow assembled: {} steps, {} enhanced, {} voice events",
                steps.size(), enhancedCount, voiceEventsCount);

        return new WorkflowDocument(
                WorkflowDocument.NAME,
                description,
                WorkflowDocument.VERSION,
                aggregator.collectVariables(steps),
                aggregator.collectConditions(steps),
                steps,
                new WorkflowMetadata(true, voiceEventsCount, correlations.size()));
    }
}
