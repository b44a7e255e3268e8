package uk.gegc.intellicode.features.assignment.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentFailure;
import uk.gegc.intellicode.shared.result.Result;

import java.util.List;
import java.util.UUID;

/**
 * Assignment authoring for course instructors and the assignment view for
 * enrolled students. Students never see the answer key.
 */
public interface AssignmentService {

    /**
     * Creates an assignment with its questions in a module the instructor owns.
     * When an attachment is given and cannot be stored or recorded, the stored
     * object is deleted and the assignment is rolled back.
     *
     * @param attachment optional file, may be {@code null}
     * @throws uk.gegc.intellicode.features.assignment.domain.exception.UploadFailedException on attachment failure
     */
    Result<AssignmentDto, AssignmentFailure> createAssignment(UUID moduleId, UUID instructorId,
                                                              CreateAssignmentRequest request, MultipartFile attachment);

    Result<AssignmentDto, AssignmentFailure> getAssignment(UUID assignmentId, UUID userId);

    Result<List<AssignmentDto>, AssignmentFailure> getModuleAssignments(UUID moduleId, UUID userId);

    Result<AssignmentDto, AssignmentFailure> updateAssignment(UUID assignmentId, UUID instructorId,
                                                              UpdateAssignmentRequest request);

    /**
     * Deletes an assignment without submissions. Attached objects are removed
     * from storage first; if that fails the assignment is kept.
     */
    Result<Void, AssignmentFailure> deleteAssignment(UUID assignmentId, UUID instructorId);

    Result<QuestionDto, AssignmentFailure> addQuestion(UUID assignmentId, UUID instructorId, QuestionRequest request);

    Result<QuestionDto, AssignmentFailure> updateQuestion(UUID assignmentId, UUID questionId, UUID instructorId,
                                                          QuestionRequest request);

    Result<Void, AssignmentFailure> deleteQuestion(UUID assignmentId, UUID questionId, UUID instructorId);
}
