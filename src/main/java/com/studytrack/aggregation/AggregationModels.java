package com.studytrack.aggregation;

import com.studytrack.domain.DomainModels.ExamRef;

import java.util.List;
import java.util.OptionalDouble;

public class AggregationModels {
    public enum TargetStatus { ON_TARGET, OFF_TARGET, UNDETERMINED }

    /** {@code FAILED}: at least one graded exam misses the pass mark; the module needs a retake. */
    public enum Standing { COMPLETED, FAILED, IN_PROGRESS, OPEN }

    public enum RequiredGradeStatus { REACHABLE, SECURED, UNREACHABLE, UNDETERMINED }

    /** {@code grade} is only present when the status is {@link RequiredGradeStatus#REACHABLE}. */
    public record RequiredGrade(RequiredGradeStatus status, OptionalDouble grade) {
        public static RequiredGrade of(RequiredGradeStatus status) {
            return new RequiredGrade(status, OptionalDouble.empty());
        }
    }

    /** {@code completed} is the raw sum; {@code reportedCompleted} is clamped to {@code required}. */
    public record CreditProgress(double completed, double reportedCompleted, double required, double ratio) {
        public double percent() {
            return Math.round(ratio * 10000.0) / 100.0;
        }
    }

    public record SemesterAverage(int semesterNumber, OptionalDouble average) {}

    public record GradeCount(double grade, long count) {}

    public record ModuleStanding(int semesterNumber, String moduleName, double credits, Standing standing, OptionalDouble average) {}

    public record UpcomingExam(ExamRef exam, long daysLeft) {}

    public record ProgressSummary(String studentName,
                                  String programName,
                                  OptionalDouble overallAverage,
                                  double targetAverage,
                                  TargetStatus targetStatus,
                                  CreditProgress credits,
                                  List<SemesterAverage> semesterAverages,
                                  List<GradeCount> gradeDistribution,
                                  List<ModuleStanding> modules,
                                  List<ExamRef> failedExams) {}
}
