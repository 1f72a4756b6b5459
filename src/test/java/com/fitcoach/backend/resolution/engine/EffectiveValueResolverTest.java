package com.fitcoach.backend.resolution.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcoach.backend.resolution.model.EffectiveValue;
import com.fitcoach.backend.resolution.model.NutritionTargets;
import com.fitcoach.backend.resolution.model.ProgramRecord;
import com.fitcoach.backend.resolution.model.SupplementItem;
import com.fitcoach.backend.resolution.model.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffectiveValueResolverTest {

    private final ObjectMapper om = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    private static ProgramRecord program(JsonNode targets, Integer goal, String instructions, List<SupplementItem> supplements) {
        return new ProgramRecord("Y", "Program Y", null, targets, goal, instructions, supplements,
                null, null, null, null);
    }

    @Test
    void zero_calorie_plan_targets_fall_back_to_program_as_a_whole() throws Exception {
        JsonNode plan = json("{\"calories\":0,\"protein\":150}");
        ProgramRecord y = program(json("{\"calories\":1800,\"protein\":140,\"carbs\":200,\"fat\":60}"), null, null, null);

        EffectiveValue<NutritionTargets> v = EffectiveValueResolver.nutritionTargets(plan, y);

        assertThat(v.source()).isEqualTo(ValueSource.PROGRAM);
        assertThat(v.value().calories()).isEqualTo(1800.0);
        // 不混合：protein 也是 program 的 140
        assertThat(v.value().protein()).isEqualTo(140.0);
        assertThat(v.value().carbs()).isEqualTo(200.0);
    }

    @Test
    void meaningful_plan_targets_win() throws Exception {
        JsonNode plan = json("{\"calories\":\"2100\",\"protein\":160,\"fiber\":30,\"water_min\":2.5}");
        ProgramRecord y = program(json("{\"calories\":1800}"), null, null, null);

        EffectiveValue<NutritionTargets> v = EffectiveValueResolver.nutritionTargets(plan, y);

        assertThat(v.source()).isEqualTo(ValueSource.PLAN);
        assertThat(v.value().calories()).isEqualTo(2100.0);
        assertThat(v.value().fiberMin()).isEqualTo(30.0);
        assertThat(v.value().waterMin()).isEqualTo(2.5);
    }

    @Test
    void malformed_targets_are_not_meaningful() throws Exception {
        assertThat(EffectiveValueResolver.isMeaningfulTargets(json("[1,2,3]"))).isFalse();
        assertThat(EffectiveValueResolver.isMeaningfulTargets(json("\"1800\""))).isFalse();
        assertThat(EffectiveValueResolver.isMeaningfulTargets(json("{}"))).isFalse();
        assertThat(EffectiveValueResolver.isMeaningfulTargets(json("{\"calories\":\"abc\"}"))).isFalse();
        assertThat(EffectiveValueResolver.isMeaningfulTargets(null)).isFalse();
    }

    @Test
    void nothing_anywhere_gives_none() throws Exception {
        EffectiveValue<NutritionTargets> v =
                EffectiveValueResolver.nutritionTargets(json("{\"calories\":0}"), program(null, null, null, null));

        assertThat(v.source()).isEqualTo(ValueSource.NONE);
        assertThat(v.value()).isNull();
        assertThat(EffectiveValueResolver.stepsGoal(null, null).isPresent()).isFalse();
        assertThat(EffectiveValueResolver.supplements(null, program(null, null, null, List.of())).isPresent()).isFalse();
    }

    @Test
    void plan_targets_without_calories_fall_back_to_program() throws Exception {
        JsonNode plan = json("{\"protein\":150,\"carbs\":200}");
        ProgramRecord y = program(json("{\"calories\":1800,\"protein\":140}"), null, null, null);

        EffectiveValue<NutritionTargets> v = EffectiveValueResolver.nutritionTargets(plan, y);

        assertThat(v.source()).isEqualTo(ValueSource.PROGRAM);
        assertThat(v.value().protein()).isEqualTo(140.0);
        assertThat(v.value().carbs()).isNull();
    }

    @Test
    void program_targets_are_shown_even_without_calories() throws Exception {
        ProgramRecord y = program(json("{\"protein\":140,\"carbs\":200,\"fat\":60}"), null, null, null);

        EffectiveValue<NutritionTargets> v = EffectiveValueResolver.nutritionTargets(null, y);

        assertThat(v.source()).isEqualTo(ValueSource.PROGRAM);
        assertThat(v.value().calories()).isNull();
        assertThat(v.value().protein()).isEqualTo(140.0);
        assertThat(v.value().fat()).isEqualTo(60.0);
    }

    @Test
    void malformed_program_targets_give_none() throws Exception {
        ProgramRecord y = program(json("[1800]"), null, null, null);

        assertThat(EffectiveValueResolver.nutritionTargets(null, y).source()).isEqualTo(ValueSource.NONE);
    }

    @Test
    void field_groups_resolve_independently() {
        ProgramRecord p = program(null, 10000, "Walk after meals", List.of(SupplementItem.named("Vitamin D")));

        EffectiveValue<Integer> goal = EffectiveValueResolver.stepsGoal(8000, p);
        EffectiveValue<String> instructions = EffectiveValueResolver.stepsInstructions("   ", p);
        EffectiveValue<List<SupplementItem>> supplements = EffectiveValueResolver.supplements(List.of(), p);

        assertThat(goal.source()).isEqualTo(ValueSource.PLAN);
        assertThat(goal.value()).isEqualTo(8000);
        assertThat(instructions.source()).isEqualTo(ValueSource.PROGRAM);
        assertThat(instructions.value()).isEqualTo("Walk after meals");
        assertThat(supplements.source()).isEqualTo(ValueSource.PROGRAM);
        assertThat(supplements.value()).extracting(SupplementItem::name).containsExactly("Vitamin D");
    }

    @Test
    void zero_plan_goal_falls_back_to_program_value_as_is() {
        ProgramRecord p = program(null, 0, "", null);

        EffectiveValue<Integer> goal = EffectiveValueResolver.stepsGoal(0, p);
        EffectiveValue<String> instructions = EffectiveValueResolver.stepsInstructions(null, p);

        // 模板上的值原樣顯示（0、空字串也算）
        assertThat(goal).isEqualTo(EffectiveValue.fromProgram(0));
        assertThat(instructions).isEqualTo(EffectiveValue.fromProgram(""));
    }
}
