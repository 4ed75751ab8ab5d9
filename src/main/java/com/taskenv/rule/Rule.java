package com.taskenv.rule;

import com.taskenv.rule.impl.CountRules;
import com.taskenv.rule.impl.DeadlineRules;
import com.taskenv.rule.impl.OrganizationRules;
import com.taskenv.rule.impl.PriorityRules;
import com.taskenv.rule.impl.TagRules;
import com.taskenv.rule.impl.TeamRules;

/**
 * The fixed set of rules an agent can complete.
 * Adding or removing a rule is a code change, never a runtime operation.
 */
public enum Rule {

    CREATE_URGENT_TASK("create_urgent_task",
            "Create a new task with 'urgent' priority",
            10.0, Difficulty.EASY, CountRules::createUrgentTask),

    COMPLETE_THREE_TASKS("complete_three_tasks",
            "Mark at least 3 tasks as completed",
            15.0, Difficulty.EASY, CountRules::completeThreeTasks),

    ORGANIZE_BY_PRIORITY("organize_by_priority",
            "Ensure all high priority tasks are either in_progress or completed",
            20.0, Difficulty.MEDIUM, PriorityRules::organizeByPriority),

    CLEAR_OVERDUE_TASKS("clear_overdue_tasks",
            "Complete or delete all tasks with past due dates",
            25.0, Difficulty.MEDIUM, DeadlineRules::clearOverdueTasks),

    ASSIGN_ALL_TASKS("assign_all_tasks",
            "Assign all unassigned tasks to team members",
            15.0, Difficulty.EASY, OrganizationRules::assignAllTasks),

    ACHIEVE_80_COMPLETION("achieve_80_completion",
            "Achieve at least 80% task completion rate",
            30.0, Difficulty.HARD, CountRules::achieve80Completion),

    ORGANIZE_WITH_TAGS("organize_with_tags",
            "Add at least 2 tags to every task for better organization",
            20.0, Difficulty.MEDIUM, OrganizationRules::organizeWithTags),

    ARCHIVE_COMPLETED("archive_completed",
            "Archive all completed tasks to clean up the board",
            15.0, Difficulty.EASY, OrganizationRules::archiveCompleted),

    BALANCE_WORKLOAD("balance_workload",
            "Distribute tasks evenly across all team members (max difference of 2 tasks)",
            25.0, Difficulty.MEDIUM, TeamRules::balanceWorkload),

    PRIORITIZE_URGENT_ITEMS("prioritize_urgent_items",
            "Ensure all urgent tasks are in_progress",
            20.0, Difficulty.MEDIUM, PriorityRules::prioritizeUrgentItems),

    CREATE_SPRINT_BACKLOG("create_sprint_backlog",
            "Create at least 5 tasks with 'sprint' tags and assign them",
            30.0, Difficulty.HARD, TagRules::createSprintBacklog),

    ELIMINATE_TECHNICAL_DEBT("eliminate_technical_debt",
            "Complete or archive all tasks tagged with 'refactor', 'technical-debt' or 'debt'",
            25.0, Difficulty.MEDIUM, TagRules::eliminateTechnicalDebt),

    ACHIEVE_ZERO_BUGS("achieve_zero_bugs",
            "Complete or delete all tasks tagged with 'bug'",
            35.0, Difficulty.HARD, TagRules::achieveZeroBugs),

    OPTIMIZE_TASK_FLOW("optimize_task_flow",
            "Ensure todo < in_progress < completed (pipeline optimization)",
            30.0, Difficulty.HARD, CountRules::optimizeTaskFlow),

    TEAM_COLLABORATION("team_collaboration",
            "Ensure every team member has at least one task in each status category",
            40.0, Difficulty.VERY_HARD, TeamRules::teamCollaboration),

    DEADLINE_MANAGEMENT("deadline_management",
            "Ensure all tasks due within 3 days are in_progress or completed",
            25.0, Difficulty.MEDIUM, DeadlineRules::deadlineManagement),

    QUALITY_ASSURANCE("quality_assurance",
            "Add 'tested', 'reviewed', 'qa' or 'approved' tags to all completed tasks",
            20.0, Difficulty.MEDIUM, TagRules::qualityAssurance),

    PERFECT_ORGANIZATION("perfect_organization",
            "All tasks must have: assignee, 2+ tags, and due date",
            35.0, Difficulty.HARD, OrganizationRules::perfectOrganization),

    REDUCE_WIP("reduce_wip",
            "Reduce work-in-progress to maximum 5 tasks",
            20.0, Difficulty.MEDIUM, CountRules::reduceWip),

    FEATURE_COMPLETION("feature_completion",
            "Complete all tasks tagged with 'feature'",
            30.0, Difficulty.HARD, TagRules::featureCompletion),

    CLEAN_SLATE("clean_slate",
            "Archive or complete all tasks - only archived tasks should remain",
            50.0, Difficulty.VERY_HARD, OrganizationRules::cleanSlate),

    MILESTONE_ACHIEVEMENT("milestone_achievement",
            "Complete at least 10 tasks in a single episode",
            40.0, Difficulty.VERY_HARD, CountRules::milestoneAchievement),

    DOCUMENTATION_COMPLETE("documentation_complete",
            "All tasks tagged 'documentation' must be completed",
            20.0, Difficulty.EASY, TagRules::documentationComplete),

    NO_LOW_PRIORITY_IN_PROGRESS("no_low_priority_in_progress",
            "Ensure no low priority tasks are in_progress when high priority tasks wait",
            25.0, Difficulty.MEDIUM, PriorityRules::noLowPriorityInProgress);

    private final String ruleName;
    private final String description;
    private final double reward;
    private final Difficulty difficulty;
    private final RuleEvaluator evaluator;

    Rule(String ruleName, String description, double reward, Difficulty difficulty, RuleEvaluator evaluator) {
        this.ruleName = ruleName;
        this.description = description;
        this.reward = reward;
        this.difficulty = difficulty;
        this.evaluator = evaluator;
    }

    public RuleDefinition toDefinition() {
        return new RuleDefinition(ruleName, description, reward, difficulty, evaluator);
    }
}
