package uk.gegc.intellicode.features.assignment.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.domain.service.SubmissionFailure;
import uk.gegc.intellicode.shared.result.Result;

import java.util.List;
import java.util.UUID;

public interface SubmissionService {

    /**
     * Grades and records a quiz submission. Nothing is stored when any answer
     * is rejected.
     */
    Result<SubmissionDto, SubmissionFailure> submitAnswers(UUID assignmentId, UUID studentId, SubmitAnswersRequest request);

    /**
     * Uploads files for a file upload assignment. If storing or recording any
     * file fails, the objects already stored are deleted and the submission is
     * rolled back.
     *
     * @throws uk.gegc.intellicode.features.assignment.domain.exception.UploadFailedException on that failure
     */
    Result<SubmissionDto, SubmissionFailure> submitFiles(UUID assignmentId, UUID studentId, List<MultipartFile> files);

    Result<SubmissionDto, SubmissionFailure> submitCode(UUID assignmentId, UUID studentId, SubmitCodeRequest request);

    List<SubmissionDto> getOwnSubmissions(UUID assignmentId, UUID studentId);

    Result<List<StudentScoreDto>, SubmissionFailure> getStudentScores(UUID assignmentId, UUID instructorId);

    Result<List<SubmissionForGradingDto>, SubmissionFailure> getSubmissionsForGrading(UUID assignmentId, UUID instructorId);

    Result<SubmissionDto, SubmissionFailure> gradeSubmission(UUID submissionId, UUID instructorId, ManualGradeRequest request);

    /**
     * Removes a student's submission so the assignment can be submitted again.
     *
     * @param actingAsTeacher whether the caller acts with the instructor role
     */
    Result<UndoSubmissionResponse, SubmissionFailure> undoSubmission(UUID assignmentId, UUID studentId,
                                                                     UUID actorId, boolean actingAsTeacher);
}
