package com.qmb.core.pipeline;

import com.qmb.core.error.WorkflowException;
import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import com.qmb.core.logging.MdcContext;
import com.qmb.core.metrics.ModelBuilderMetrics;
import com.qmb.core.model.StageArtifact;
import com.qmb.core.model.StageId;
import com.qmb.core.script.BuildContext;
import com.qmb.core.script.ScriptAssembler;
import com.qmb.core.script.ScriptFragment;
import com.qmb.core.script.ScriptFragmentBuilder;
import com.qmb.core.session.BuildSession;
import com.qmb.core.session.SessionState;
import com.qmb.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The A-F build/approve/revert state machine.
 * <p>
 * Approved stages always form a contiguous prefix of A-F. Every transition is computed on
 * a copy of the stage map and published as a new session snapshot, so a rejected
 * transition leaves the session untouched.
 */
@Service
public class StagePipeline {

    private static final Logger log = LoggerFactory.getLogger(StagePipeline.class);

    private final SessionStore sessionStore;
    private final EventBus eventBus;
    private final ModelBuilderMetrics metrics;
    private final Map<StageId, ScriptFragmentBuilder> builders = new EnumMap<>(StageId.class);

    public StagePipeline(SessionStore sessionStore, List<ScriptFragmentBuilder> fragmentBuilders,
                         EventBus eventBus, ModelBuilderMetrics metrics) {
        this.sessionStore = sessionStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        for (ScriptFragmentBuilder builder : fragmentBuilders) {
            if (builders.put(builder.stage(), builder) != null) {
                throw new IllegalStateException("Duplicate fragment builder for stage " + builder.stage());
            }
        }
        for (StageId id : StageId.values()) {
            if (!builders.containsKey(id)) {
                throw new IllegalStateException("No fragment builder registered for stage " + id);
            }
        }
    }

    /**
     * Generates the script fragment for {@code requested}, or for the current stage when
     * {@code requested} is {@code null}. A stage may be built once its predecessor is
     * approved, or one step ahead of the pointer while the current stage is still a draft.
     * Rebuilding the current stage after {@link #goBack} replaces its approved text with a
     * draft and discards later drafts.
     *
     * @throws WorkflowException if no model type is selected or the stage is out of order
     */
    public StageBuildResult build(StageId requested) {
        return sessionStore.withActiveSession(session -> {
            SessionState state = session.state();
            if (state.modelType() == null) {
                throw new WorkflowException("Model type not selected. Call qmb_select_model_type first.");
            }
            if (state.analysis() == null) {
                throw new WorkflowException("No analysis available. Call qmb_process_input first.");
            }
            StageId target = requested != null ? requested : state.currentStage();
            checkBuildable(state, target);

            MdcContext.setStage(session.getId(), session.getProjectName(), target);
            try {
                Instant now = Instant.now();
                BuildContext context = new BuildContext(session.getProjectName(), state.analysis(),
                        state.modelType(), state.config(), state.approvedStages(), now);
                ScriptFragment fragment = builders.get(target).build(context);
                StageArtifact artifact = StageArtifact.built(target, fragment.script(), fragment.tables(), now);

                Map<StageId, StageArtifact> stages = new EnumMap<>(state.stages());
                List<StageId> discarded = new ArrayList<>();
                if (state.stage(target).approved()) {
                    // A revised stage invalidates drafts generated from its approved text.
                    for (StageId id : StageId.values()) {
                        if (id.isAfter(target) && stages.get(id).isBuilt()) {
                            discarded.add(id);
                            stages.put(id, StageArtifact.unbuilt(id));
                        }
                    }
                }
                stages.put(target, artifact);
                session.replaceState(state.withStages(stages, state.currentStage(), false, now));
                if (!discarded.isEmpty()) {
                    log.info("Rebuilding approved stage {} discarded draft(s) {}", target.label(), discarded);
                }

                log.info("Built stage {} ({} line(s), {} table(s))", target.label(),
                        artifact.script().lines().count(), artifact.tables().size());
                metrics.recordStageBuild(target);
                eventBus.publish(ModelBuilderEvent.of("stage.built", session.getId(), target.name(),
                        Map.of("tables", artifact.tables())));

                String preview = null;
                if (target.isLast()) {
                    List<StageArtifact> parts = new ArrayList<>(state.approvedStages());
                    parts.removeIf(a -> a.stageId() == StageId.F);
                    parts.add(artifact);
                    preview = ScriptAssembler.assemble(parts);
                }
                return new StageBuildResult(artifact, preview);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Approves the current stage and advances the pointer.
     *
     * @throws WorkflowException if the current stage has not been built or the pipeline is complete
     */
    public ApprovalResult approve() {
        return sessionStore.withActiveSession(session -> {
            SessionState state = session.state();
            if (state.complete()) {
                throw new WorkflowException("All stages are already approved. Use qmb_go_back to revise a stage.");
            }
            StageId current = state.currentStage();
            StageArtifact artifact = state.stage(current);
            if (!artifact.isBuilt()) {
                throw new WorkflowException("Stage " + current.label() + " has not been built. Call qmb_build_stage first.");
            }

            MdcContext.setStage(session.getId(), session.getProjectName(), current);
            try {
                Instant now = Instant.now();
                StageArtifact approved = artifact.approve(now);
                Map<StageId, StageArtifact> stages = new EnumMap<>(state.stages());
                stages.put(current, approved);
                boolean done = current.isLast();
                SessionState next = state.withStages(stages, current.next(), done, now);
                session.replaceState(next);

                log.info("Approved stage {}", current.label());
                metrics.recordStageApproval(current);
                eventBus.publish(ModelBuilderEvent.of("stage.approved", session.getId(), current.name(),
                        Map.of("scriptHash", ScriptAssembler.fingerprint(approved.script()))));
                return new ApprovalResult(current, done ? null : current.next(), next.progressPercent(), done);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Moves the pointer back to {@code target}. Every later stage returns to unbuilt; the
     * target keeps its script and approval until it is rebuilt or approved again.
     *
     * @throws WorkflowException if {@code target} lies ahead of the current stage
     */
    public RevertResult goBack(StageId target) {
        return sessionStore.withActiveSession(session -> {
            SessionState state = session.state();
            if (target.isAfter(state.currentStage())) {
                throw new WorkflowException("Cannot go back to stage " + target.label()
                        + ": it is ahead of the current stage " + state.currentStage().label());
            }

            MdcContext.setStage(session.getId(), session.getProjectName(), target);
            try {
                Instant now = Instant.now();
                Map<StageId, StageArtifact> stages = new EnumMap<>(state.stages());
                List<StageId> invalidated = new ArrayList<>();
                for (StageId id : StageId.values()) {
                    if (id.isAfter(target) && stages.get(id).isBuilt()) {
                        invalidated.add(id);
                        stages.put(id, StageArtifact.unbuilt(id));
                    }
                }
                session.replaceState(state.withStages(stages, target, false, now));

                log.info("Reverted to stage {}, invalidated {}", target.label(), invalidated);
                metrics.recordStageRevert(target);
                eventBus.publish(ModelBuilderEvent.of("stage.reverted", session.getId(), target.name(),
                        Map.of("invalidated", invalidated.stream().map(Enum::name).toList())));
                return new RevertResult(target, List.copyOf(invalidated));
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Ordered concatenation of the approved fragments. Unapproved drafts are never included.
     *
     * @throws WorkflowException if nothing has been approved yet
     */
    public String getScript() {
        SessionState state = sessionStore.requireActive().state();
        List<StageArtifact> approved = state.approvedStages();
        if (approved.isEmpty()) {
            throw new WorkflowException("No approved stages yet. Build and approve stage A first.");
        }
        return ScriptAssembler.assemble(approved);
    }

    private void checkBuildable(SessionState state, StageId target) {
        StageArtifact artifact = state.stage(target);
        StageId pointer = state.currentStage();
        if (artifact.approved() && (target != pointer || state.complete())) {
            throw new WorkflowException("Stage " + target.label()
                    + " is already approved. Use qmb_go_back to revise it.");
        }
        if (target.ordinal() > pointer.ordinal() + 1) {
            StageId predecessor = StageId.values()[target.ordinal() - 1];
            throw new WorkflowException("Cannot build stage " + target.label() + " before stage "
                    + predecessor.label() + " is approved. Current stage is " + pointer.label());
        }
    }
}
