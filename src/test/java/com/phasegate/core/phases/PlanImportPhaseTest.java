package com.phasegate.core.phases;

import com.phasegate.core.errors.PlanException;
import com.phasegate.core.model.ImplementationPlan;
import com.phasegate.core.model.ImplementationPlan.PlanPhase;
import com.phasegate.core.model.ImplementationPlan.PlanTask;
import com.phasegate.core.model.TaskStatus;
import com.phasegate.core.state.JsonProjectStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanImportPhaseTest {

    static final String VALID_PLAN = """
            {
              "projectName": "Online Shop",
              "phases": [
                {
                  "phaseNumber": 2,
                  "name": "Checkout",
                  "tasks": [
                    {"id": "2.1", "description": "Cart totals", "acceptanceCriteria": ["Sums prices"], "dependsOn": ["1.1"]}
                  ]
                },
                {
                  "phaseNumber": 1,
                  "name": "Catalog",
                  "description": "Product listing",
                  "tasks": [
                    {"id": "1.1", "description": "Product model", "acceptanceCriteria": ["Has a price"]},
                    {"id": "1.2", "description": "Listing page", "dependsOn": ["1.1"]}
                  ]
                }
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private JsonProjectStateStore store;
    private PlanImportPhase phase;
    private final PhaseRunnerDriver driver = new PhaseRunnerDriver();

    @BeforeEach
    void setUp() {
        store = new JsonProjectStateStore(tempDir.resolve("state.json"), JsonProjectStateStore.defaultMapper(), "workdir");
        phase = new PlanImportPhase(store, JsonProjectStateStore.defaultMapper());
    }

    private Path planFile(String json) throws IOException {
        return Files.writeString(tempDir.resolve("plan.json"), json);
    }

    private static PlanTask task(String id, String... deps) {
        return new PlanTask(id, "Task " + id, List.of(), List.of(deps));
    }

    @Nested
    @DisplayName("import")
    class Import {

        @Test
        @DisplayName("a valid plan is stored with every task pending, awaiting planning approval")
        void validPlan() throws IOException {
            PhaseOutcome<ImplementationPlan> outcome = driver.run(phase, planFile(VALID_PLAN));

            assertTrue(outcome.success(), outcome.error());
            assertEquals(3, outcome.data().taskCount());
            assertEquals(List.of(1, 2), store.getPhases().stream().map(p -> p.phaseNumber()).toList());
            assertEquals(1, store.getCurrentImplPhase());
            assertFalse(store.isApproved(PlanImportPhase.PLANNING_APPROVAL));
            assertEquals("Online Shop", store.getProjectName());
            assertTrue(store.getAllTasks().stream().allMatch(t -> t.status() == TaskStatus.PENDING));
            assertEquals(List.of("1.1"), store.findTask("2.1").orElseThrow().dependsOn());
            assertTrue(store.findTask("1.2").orElseThrow().acceptanceCriteria().isEmpty());
        }

        @Test
        @DisplayName("re-importing drops earlier approvals and keeps the name when the plan has none")
        void reimport() throws IOException {
            driver.run(phase, planFile(VALID_PLAN));
            store.approvePhase(PlanImportPhase.PLANNING_APPROVAL);
            store.approvePhase("impl-1");

            PhaseOutcome<ImplementationPlan> outcome = driver.run(phase, planFile("""
                    {"phases": [{"phaseNumber": 1, "name": "Catalog", "tasks": [{"id": "1.1"}]}]}
                    """));

            assertTrue(outcome.success(), outcome.error());
            assertEquals("Online Shop", store.getProjectName());
            assertFalse(store.isApproved(PlanImportPhase.PLANNING_APPROVAL));
            assertFalse(store.isApproved("impl-1"));
            assertEquals(1, store.getAllTasks().size());
        }

        @Test
        @DisplayName("a missing file fails during setup")
        void missingFile() {
            PhaseOutcome<ImplementationPlan> outcome = driver.run(phase, tempDir.resolve("nope.json"));

            assertFalse(outcome.success());
            assertEquals(PhaseStage.SETTING_UP, outcome.failedStage());
            assertTrue(outcome.error().startsWith("Plan file not found"));
        }

        @Test
        @DisplayName("malformed JSON fails during execution and stores nothing")
        void malformedJson() throws IOException {
            PhaseOutcome<ImplementationPlan> outcome = driver.run(phase, planFile("{ \"phases\": [ "));

            assertEquals(PhaseStage.EXECUTING, outcome.failedStage());
            assertTrue(outcome.error().startsWith("Could not read plan"));
            assertTrue(store.getPhases().isEmpty());
            assertFalse(store.isApproved(PlanImportPhase.PLANNING_APPROVAL));
        }

        @Test
        @DisplayName("an invalid plan reports its problems and keeps the previous plan")
        void invalidPlanKeepsPrevious() throws IOException {
            driver.run(phase, planFile(VALID_PLAN));

            PhaseOutcome<ImplementationPlan> outcome = driver.run(phase, planFile("""
                    {"phases": [{"phaseNumber": 1, "name": "Loop", "tasks": [
                      {"id": "1.1", "dependsOn": ["1.2"]},
                      {"id": "1.2", "dependsOn": ["1.1"]}
                    ]}]}
                    """));

            assertFalse(outcome.success());
            assertEquals(PhaseStage.EXECUTING, outcome.failedStage());
            assertTrue(outcome.error().contains("circular"));
            assertEquals(3, store.getAllTasks().size());
        }

        @Test
        @DisplayName("the thrown exception carries every problem")
        void planExceptionProblems() throws IOException {
            Path file = planFile("""
                    {"phases": [{"phaseNumber": 1, "name": "A", "tasks": [
                      {"id": "1.1"}, {"id": "1.1"}, {"id": " "}
                    ]}]}
                    """);

            PlanException e = assertThrows(PlanException.class, () -> phase.execute(file));
            assertEquals(2, e.getProblems().size());
            assertTrue(e.getMessage().startsWith("Plan has 2 problem(s)"));
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("an empty plan is rejected")
        void noPhases() {
            assertEquals(List.of("plan has no phases"), PlanImportPhase.check(new ImplementationPlan("x", null)));
        }

        @Test
        @DisplayName("phase numbers must be positive and unique")
        void phaseNumbers() {
            List<String> problems = PlanImportPhase.check(new ImplementationPlan("x", List.of(
                    new PlanPhase(0, "Zero", null, List.of(task("0.1"))),
                    new PlanPhase(1, "One", null, List.of(task("1.1"))),
                    new PlanPhase(1, "Again", null, List.of(task("1.2"))))));

            assertEquals(List.of("phase 'Zero' has non-positive number 0", "duplicate phase number 1"), problems);
        }

        @Test
        @DisplayName("task IDs must be unique across phases")
        void duplicateIdsAcrossPhases() {
            List<String> problems = PlanImportPhase.check(new ImplementationPlan("x", List.of(
                    new PlanPhase(1, "One", null, List.of(task("1.1"))),
                    new PlanPhase(2, "Two", null, List.of(task("1.1"))))));

            assertEquals(List.of("duplicate task id 1.1"), problems);
        }

        @Test
        @DisplayName("dependency problems are reported by type")
        void dependencyProblems() {
            List<String> problems = PlanImportPhase.check(new ImplementationPlan("x", List.of(
                    new PlanPhase(1, "One", null, List.of(task("1.1", "9.9"), task("1.2", "1.2"))))));

            assertTrue(problems.stream().anyMatch(p -> p.startsWith("missing: ")));
            assertTrue(problems.stream().anyMatch(p -> p.startsWith("self_reference: ")));
        }

        @Test
        @DisplayName("dependencies may point to tasks of other phases")
        void crossPhaseDependency() {
            assertTrue(PlanImportPhase.check(new ImplementationPlan("x", List.of(
                    new PlanPhase(1, "One", null, List.of(task("1.1"))),
                    new PlanPhase(2, "Two", null, List.of(task("2.1", "1.1")))))).isEmpty());
        }
    }
}
