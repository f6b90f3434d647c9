package com.example.archiveindexer.plan;

import com.example.archiveindexer.model.ArchiveModel;
import com.example.archiveindexer.model.DirectoryNode;
import com.example.archiveindexer.model.FileEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncrementalPlannerTest {
    private static final Instant OLD = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant MARKER = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-02T00:00:00Z");

    private final IncrementalPlanner planner = new IncrementalPlanner();

    private static ArchiveModel model(Instant gamesModified, Instant adventModified) {
        ArchiveModel model = new ArchiveModel("if-archive", OLD);
        DirectoryNode games = model.addDirectory(model.root(), "games", gamesModified);
        model.addDirectory(model.root(), "docs", OLD);
        model.addFile(FileEntry.regular(games, "advent.z5", 10, adventModified, null));
        model.addFile(FileEntry.regular(model.root(), "README", 10, OLD, null));
        model.sortEntries();
        return model;
    }

    @Test
    void fullRebuildWithoutMarker() {
        BuildPlan plan = planner.plan(model(OLD, OLD), Optional.empty(), NOW, OLD, false, name -> true);

        assertTrue(plan.full());
        assertEquals(Set.of("if-archive", "if-archive/games", "if-archive/docs"), plan.directoryPages());
        assertEquals(EnumSet.allOf(DateWindow.class), plan.windows());
    }

    @Test
    void fullRebuildWhenForcedOrDocumentChanged() {
        assertTrue(planner.plan(model(OLD, OLD), Optional.of(MARKER), NOW, OLD, true, name -> true).full());
        assertTrue(planner.plan(model(OLD, OLD), Optional.of(MARKER), NOW, MARKER.plusSeconds(1), false, name -> true).full());
    }

    @Test
    void nothingToDoWhenUnchanged() {
        BuildPlan plan = planner.plan(model(OLD, OLD), Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertFalse(plan.full());
        assertTrue(plan.directoryPages().isEmpty());
        assertTrue(plan.windows().isEmpty());
        assertEquals(0, plan.pageCount());
    }

    @Test
    void changedFileRegeneratesItsDirectoryAndEveryWindow() {
        BuildPlan plan = planner.plan(model(OLD, MARKER.plusSeconds(30)), Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertEquals(Set.of("if-archive/games"), plan.directoryPages());
        assertEquals(EnumSet.allOf(DateWindow.class), plan.windows());
    }

    @Test
    void changedSubdirectoryRegeneratesParentPage() {
        BuildPlan plan = planner.plan(model(MARKER.plusSeconds(30), OLD), Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertEquals(Set.of("if-archive", "if-archive/games"), plan.directoryPages());
        assertEquals(EnumSet.allOf(DateWindow.class), plan.windows());
    }

    @Test
    void missingOutputsAreRegenerated() {
        BuildPlan plan = planner.plan(model(OLD, OLD), Optional.of(MARKER), NOW, OLD, false,
                name -> !name.equals("if-archive/docs/index.html") && !name.equals("date_2.html"));

        assertEquals(Set.of("if-archive/docs"), plan.directoryPages());
        assertEquals(EnumSet.of(DateWindow.MONTH), plan.windows());
    }

    @Test
    void fileAgingOutOfWindowRegeneratesThatWindow() {
        Instant weekOld = MARKER.minusSeconds(7 * 24 * 3600 - 60);
        BuildPlan plan = planner.plan(model(OLD, weekOld), Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertTrue(plan.directoryPages().isEmpty());
        assertEquals(EnumSet.of(DateWindow.WEEK), plan.windows());
    }

    @Test
    void uploadOfMentionedFileRegeneratesDeclaringPage() {
        ArchiveModel model = model(OLD, OLD);
        DirectoryNode games = model.directory("if-archive/games").orElseThrow();
        model.addDirectory(games, "zcode", MARKER.plusSeconds(30));
        model.sortEntries();
        model.addDependency("if-archive/games/zcode/new.z5", "if-archive");

        BuildPlan plan = planner.plan(model, Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertEquals(Set.of("if-archive", "if-archive/games", "if-archive/games/zcode"), plan.directoryPages());
    }

    @Test
    void entryKeepingItsOwnTimeStillDirtiesPagesShowingIt() {
        ArchiveModel model = model(MARKER.plusSeconds(30), OLD);
        model.addDependency("if-archive/games/advent.z5", "if-archive/docs");

        BuildPlan plan = planner.plan(model, Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertTrue(plan.directoryPages().contains("if-archive/docs"));
    }

    @Test
    void untouchedDependencyLeavesPageAlone() {
        ArchiveModel model = model(OLD, OLD);
        model.addDependency("if-archive/games/advent.z5", "if-archive/docs");
        model.addDependency("if-archive/games/missing.z5", "if-archive");

        BuildPlan plan = planner.plan(model, Optional.of(MARKER), NOW, OLD, false, name -> true);

        assertTrue(plan.directoryPages().isEmpty());
        assertFalse(IncrementalPlanner.targetChanged(model, "if-archive/games/advent.z5", MARKER));
        assertTrue(IncrementalPlanner.targetChanged(model(OLD, MARKER.plusSeconds(1)), "if-archive/games/advent.z5", MARKER));
    }

    @Test
    void windowsUseModificationTimePlusLength() {
        Instant now = Instant.parse("2024-03-08T00:00:00Z");
        assertTrue(DateWindow.WEEK.includes(Instant.parse("2024-03-01T00:00:00Z"), now));
        assertFalse(DateWindow.WEEK.includes(Instant.parse("2024-02-29T23:59:59Z"), now));
        assertTrue(DateWindow.ALL.includes(Instant.EPOCH, now));
        assertEquals("date_3.html", DateWindow.QUARTER.fileName());
        assertEquals("three months", DateWindow.QUARTER.label().orElseThrow());
    }
}
