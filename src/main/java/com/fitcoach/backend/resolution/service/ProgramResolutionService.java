package com.fitcoach.backend.resolution.service;

import com.fitcoach.backend.resolution.engine.ProgramResolutionEngine;
import com.fitcoach.backend.resolution.model.*;
import com.fitcoach.backend.resolution.store.ClientRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * I/O 邊界：把 assignments + 4 種 plan 同時讀出來（fan-out），全部回來後（fan-in）交給 engine。
 * 每次呼叫都重新讀，不做任何快取。
 */
@Slf4j
@Service
public class ProgramResolutionService {

    private final ClientRecordStore store;
    private final ProgramResolutionEngine engine;
    private final ProgramResolutionProperties props;
    private final Executor executor;
    private final Clock clock;

    public ProgramResolutionService(
            ClientRecordStore store,
            ProgramResolutionEngine engine,
            ProgramResolutionProperties props,
            @Qualifier("planFetchExecutor") Executor executor,
            Clock clock
    ) {
        this.store = store;
        this.engine = engine;
        this.props = props;
        this.executor = executor;
        this.clock = clock;
    }

    public ProgramHistory resolve(String customerId, String leadId) {
        ClientKey key = ClientKey.of(customerId, leadId);
        if (key.isEmpty()) return ProgramHistory.empty(key);

        ClientSnapshot snapshot = fetchSnapshot(key, () -> store.fetchAssignments(key));
        ProgramHistory result = engine.resolve(key, snapshot, today());
        logResult(key, result);
        return result;
    }

    /**
     * lead 頁面：lead 沒有自己的 assignment 時，也要看得到 customer 層級的 program。
     */
    public ProgramHistory resolveForLead(String leadId) {
        ClientKey bare = ClientKey.of(null, leadId);
        if (bare.isEmpty()) return ProgramHistory.empty(bare);
        String lid = bare.leadId();

        Set<RecordKind> lookupDegraded = EnumSet.noneOf(RecordKind.class);
        Optional<LeadRecord> lead = readNow(RecordKind.ASSIGNMENT, () -> store.findLead(lid), Optional.empty(), lookupDegraded);
        String customerId = lead.map(LeadRecord::customerId).orElse(null);

        List<String> customerLeadIds = new ArrayList<>();
        if (customerId != null) {
            customerLeadIds.addAll(readNow(RecordKind.ASSIGNMENT,
                    () -> store.findLeadIdsOfCustomer(customerId), List.of(), lookupDegraded));
        }
        if (!customerLeadIds.contains(lid)) customerLeadIds.add(lid);

        LeadScope scope = new LeadScope(lid, customerId, customerLeadIds);
        ClientSnapshot snapshot = fetchSnapshot(scope.clientKey(),
                () -> store.fetchAssignmentsForCustomerOrLeads(customerId, scope.customerLeadIds()));
        if (!lookupDegraded.isEmpty()) {
            Set<RecordKind> merged = EnumSet.copyOf(lookupDegraded);
            merged.addAll(snapshot.degradedKinds());
            snapshot = new ClientSnapshot(snapshot.assignments(), snapshot.programs(), snapshot.workoutPlans(),
                    snapshot.nutritionPlans(), snapshot.supplementPlans(), snapshot.stepsPlans(), merged);
        }

        ProgramHistory result = engine.resolveForLead(scope, snapshot, today());
        logResult(scope.clientKey(), result);
        return result;
    }

    // ===== fan-out / fan-in =====

    private ClientSnapshot fetchSnapshot(ClientKey key, Supplier<List<AssignmentRecord>> assignmentRead) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<List<AssignmentRecord>> assignmentsF = submit(assignmentRead, mdc);
        CompletableFuture<List<PlanRecord<WorkoutRoutine>>> workoutF = submit(() -> store.fetchWorkoutPlans(key), mdc);
        CompletableFuture<List<PlanRecord<NutritionPayload>>> nutritionF = submit(() -> store.fetchNutritionPlans(key), mdc);
        CompletableFuture<List<PlanRecord<SupplementPayload>>> supplementF = submit(() -> store.fetchSupplementPlans(key), mdc);
        CompletableFuture<List<PlanRecord<StepsPayload>>> stepsF = submit(() -> store.fetchStepsPlans(key), mdc);

        Set<RecordKind> degraded = EnumSet.noneOf(RecordKind.class);
        List<AssignmentRecord> assignments = join(RecordKind.ASSIGNMENT, assignmentsF, List.of(), degraded);
        List<PlanRecord<WorkoutRoutine>> workout = join(RecordKind.WORKOUT, workoutF, List.of(), degraded);
        List<PlanRecord<NutritionPayload>> nutrition = join(RecordKind.NUTRITION, nutritionF, List.of(), degraded);
        List<PlanRecord<SupplementPayload>> supplements = join(RecordKind.SUPPLEMENT, supplementF, List.of(), degraded);
        List<PlanRecord<StepsPayload>> steps = join(RecordKind.STEPS, stepsF, List.of(), degraded);

        // assignments 回來之後才知道要讀哪些 Budget（一次 findAllById）
        Set<String> programIds = new LinkedHashSet<>();
        assignments.stream().map(AssignmentRecord::programId).filter(Objects::nonNull).forEach(programIds::add);
        Map<String, ProgramRecord> programs = programIds.isEmpty()
                ? Map.of()
                : readNow(RecordKind.PROGRAM, () -> store.findPrograms(programIds), Map.of(), degraded);

        return new ClientSnapshot(assignments, programs, workout, nutrition, supplements, steps, degraded);
    }

    /** pool 滿了（TaskRejectedException）也當成這一種讀取失敗，交給 onReadFailure */
    private <T> CompletableFuture<T> submit(Supplier<T> read, Map<String, String> mdc) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> withMdc(mdc, read), executor)
                    .orTimeout(props.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T join(RecordKind kind, CompletableFuture<T> future, T fallback, Set<RecordKind> degraded) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            return onReadFailure(kind, cause, fallback, degraded);
        }
    }

    private <T> T readNow(RecordKind kind, Supplier<T> read, T fallback, Set<RecordKind> degraded) {
        try {
            return read.get();
        } catch (RuntimeException e) {
            return onReadFailure(kind, e, fallback, degraded);
        }
    }

    /** strict：整個 call 失敗；degraded：這一種當空、記下來，其他照常 */
    private <T> T onReadFailure(RecordKind kind, Throwable cause, T fallback, Set<RecordKind> degraded) {
        if (props.isStrictConsistency()) {
            throw new ProgramResolutionException(kind, kind.name() + "_READ_FAILED", cause);
        }
        log.warn("read degraded kind={} cause={}", kind, cause.toString());
        degraded.add(kind);
        return fallback;
    }

    private static <T> T withMdc(Map<String, String> mdc, Supplier<T> read) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) MDC.setContextMap(mdc);
        try {
            return read.get();
        } finally {
            if (previous != null) MDC.setContextMap(previous);
            else MDC.clear();
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneId.of(props.getZone())));
    }

    private static void logResult(ClientKey key, ProgramHistory r) {
        if (!log.isDebugEnabled()) return;
        log.debug("resolved customerId={} leadId={} activeProgram={} workout={} nutrition={} supplements={} steps={} degraded={}",
                key.customerId(), key.leadId(),
                r.activeProgram() == null ? null : r.activeProgram().programId(),
                r.workoutHistory().size(), r.nutritionHistory().size(),
                r.supplementHistory().size(), r.stepsHistory().size(),
                r.degradedKinds());
    }
}
