package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.PlanEntry;
import com.fitcoach.backend.resolution.model.PlanRecord;
import com.fitcoach.backend.resolution.model.ProgramRecord;
import com.fitcoach.backend.resolution.model.StepsPayload;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 標出每種 kind 的 active plan（最多一筆）並排出顯示順序：active 在最前，其餘新到舊。
 */
public final class PlanActivityFlagger {
    private PlanActivityFlagger() {}

    public static <P> List<PlanEntry<P>> flag(List<PlanRecord<P>> deduplicated, String activeProgramId) {
        if (deduplicated == null || deduplicated.isEmpty()) return List.of();

        int activeIdx = -1;
        if (activeProgramId != null) {
            for (int i = 0; i < deduplicated.size(); i++) {
                PlanRecord<P> r = deduplicated.get(i);
                if (!activeProgramId.equals(r.programId())) continue;
                if (activeIdx < 0 || PlanOrdering.isNewer(r, deduplicated.get(activeIdx))) activeIdx = i;
            }
        }

        List<PlanRecord<P>> rest = new ArrayList<>(deduplicated.size());
        for (int i = 0; i < deduplicated.size(); i++) {
            if (i != activeIdx) rest.add(deduplicated.get(i));
        }
        rest.sort(PlanOrdering.newestFirst());

        List<PlanEntry<P>> out = new ArrayList<>(deduplicated.size());
        if (activeIdx >= 0) out.add(PlanEntry.of(deduplicated.get(activeIdx), true));
        for (PlanRecord<P> r : rest) out.add(PlanEntry.of(r, false));
        return List.copyOf(out);
    }

    /**
     * steps 特例：完全沒有 steps plan、但 active Budget 本身有步數目標/說明時，
     * 補一筆 synthetic 的「目前」entry（日期 = today），讓畫面看得到值。
     */
    public static List<PlanEntry<StepsPayload>> flagSteps(
            List<PlanRecord<StepsPayload>> deduplicated,
            String activeProgramId,
            ProgramRecord activeProgram,
            LocalDate today
    ) {
        if ((deduplicated == null || deduplicated.isEmpty()) && hasStepsFields(activeProgram)) {
            StepsPayload fromProgram = new StepsPayload(
                    null, activeProgram.stepsGoal(), activeProgram.stepsInstructions());
            return List.of(new PlanEntry<>(null, activeProgramId, today, null, null, true, true, fromProgram));
        }
        return flag(deduplicated, activeProgramId);
    }

    private static boolean hasStepsFields(ProgramRecord program) {
        if (program == null) return false;
        return EffectiveValueResolver.isMeaningfulGoal(program.stepsGoal())
                || EffectiveValueResolver.isMeaningfulText(program.stepsInstructions());
    }
}
