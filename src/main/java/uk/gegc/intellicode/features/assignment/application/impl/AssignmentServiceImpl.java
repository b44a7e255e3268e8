package uk.gegc.intellicode.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.application.AssignmentService;
import uk.gegc.intellicode.features.assignment.config.AssignmentStorageProperties;
import uk.gegc.intellicode.features.assignment.domain.exception.UploadFailedException;
import uk.gegc.intellicode.features.assignment.domain.model.*;
import uk.gegc.intellicode.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.intellicode.features.assignment.domain.repository.SubmissionRepository;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentError;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentFailure;
import uk.gegc.intellicode.features.assignment.infra.grading.QuestionGraderFactory;
import uk.gegc.intellicode.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.intellicode.features.assignment.infra.storage.AssignmentFileStorage;
import uk.gegc.intellicode.features.assignment.infra.storage.StoredObject;
import uk.gegc.intellicode.features.assignment.infra.storage.UploadNames;
import uk.gegc.intellicode.features.course.domain.model.CourseModule;
import uk.gegc.intellicode.features.course.domain.model.EnrollmentStatus;
import uk.gegc.intellicode.features.course.domain.repository.CourseModuleRepository;
import uk.gegc.intellicode.features.course.domain.repository.EnrollmentRepository;
import uk.gegc.intellicode.shared.exception.StorageException;
import uk.gegc.intellicode.shared.result.Result;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentServiceImpl implements AssignmentService {

    private final AssignmentRepository assignmentRepository;
    private final CourseModuleRepository moduleRepository;
    private final SubmissionRepository submissionRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final QuestionGraderFactory graderFactory;
    private final AssignmentFileStorage fileStorage;
    private final AssignmentStorageProperties storageProperties;
    private final AssignmentMapper assignmentMapper;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    @Transactional
    public Result<AssignmentDto, AssignmentFailure> createAssignment(UUID moduleId, UUID instructorId,
                                                                     CreateAssignmentRequest request,
                                                                     MultipartFile attachment) {
        Optional<CourseModule> module = moduleRepository.findWithCourseById(moduleId)
                .filter(m -> m.getCourse().isOwnedBy(instructorId));
        if (module.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.MODULE_NOT_FOUND));
        }

        MultipartFile upload = attachment == null || attachment.isEmpty() ? null : attachment;
        if (upload != null && upload.getSize() > storageProperties.getMaxFileSizeBytes()) {
            return Result.err(AssignmentFailure.of(AssignmentError.ATTACHMENT_TOO_LARGE,
                    "Attachment " + UploadNames.displayName(upload.getOriginalFilename())
                            + " exceeds the maximum size of " + storageProperties.getMaxFileSizeBytes() + " bytes"));
        }

        Result<List<Question>, AssignmentFailure> questions = buildQuestions(request.questions());
        if (questions.isErr()) {
            return Result.err(questions.getError());
        }

        Assignment assignment = new Assignment();
        assignment.setModule(module.get());
        assignment.setTitle(request.title().trim());
        assignment.setDescription(request.description());
        assignment.setSubtype(request.subtype());
        assignment.setPoints(request.points());
        assignment.setDueDate(request.dueDate());
        assignment.setPublished(request.published());
        assignment.setStarterCode(starterCodeFor(request.subtype(), request.starterCode()));
        questions.getValue().forEach(assignment::addQuestion);

        Assignment saved = assignmentRepository.saveAndFlush(assignment);
        if (upload != null) {
            saved = attach(saved, upload);
        }
        log.info("Instructor {} created {} assignment {} with {} question(s) in module {}",
                instructorId, saved.getSubtype(), saved.getId(), saved.getQuestions().size(), moduleId);
        return Result.ok(assignmentMapper.toDto(saved, true, false));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<AssignmentDto, AssignmentFailure> getAssignment(UUID assignmentId, UUID userId) {
        Optional<Assignment> found = assignmentRepository.findWithCourseById(assignmentId);
        if (found.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.ASSIGNMENT_NOT_FOUND));
        }
        Assignment assignment = found.get();
        if (assignment.getCourse().isOwnedBy(userId)) {
            return Result.ok(assignmentMapper.toDto(assignment, true, false));
        }

        // students see published assignments of courses they actively attend, without the answer key
        if (!assignment.isPublished() || !isEnrolled(assignment.getCourse().getId(), userId)) {
            return Result.err(AssignmentFailure.of(AssignmentError.ASSIGNMENT_NOT_FOUND));
        }
        boolean submitted = submissionRepository.countByAssignmentIdAndStudentId(assignmentId, userId) > 0;
        return Result.ok(assignmentMapper.toDto(assignment, false, submitted));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<AssignmentDto>, AssignmentFailure> getModuleAssignments(UUID moduleId, UUID userId) {
        Optional<CourseModule> found = moduleRepository.findWithCourseById(moduleId);
        if (found.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.MODULE_NOT_ACCESSIBLE));
        }
        CourseModule module = found.get();
        List<Assignment> assignments = assignmentRepository.findAllByModuleIdOrderByCreatedAtAsc(moduleId);

        if (module.getCourse().isOwnedBy(userId)) {
            return Result.ok(assignments.stream()
                    .map(a -> assignmentMapper.toDto(a, true, false))
                    .toList());
        }
        if (!isEnrolled(module.getCourse().getId(), userId)) {
            return Result.err(AssignmentFailure.of(AssignmentError.MODULE_NOT_ACCESSIBLE));
        }

        List<Assignment> visible = assignments.stream().filter(Assignment::isPublished).toList();
        if (visible.isEmpty()) {
            return Result.ok(List.of());
        }
        Set<UUID> submitted = submissionRepository.findSubmittedAssignmentIds(userId,
                visible.stream().map(Assignment::getId).toList());
        return Result.ok(visible.stream()
                .map(a -> assignmentMapper.toDto(a, false, submitted.contains(a.getId())))
                .toList());
    }

    @Override
    @Transactional
    public Result<AssignmentDto, AssignmentFailure> updateAssignment(UUID assignmentId, UUID instructorId,
                                                                     UpdateAssignmentRequest request) {
        Result<Assignment, AssignmentFailure> owned = loadOwned(assignmentId, instructorId);
        if (owned.isErr()) {
            return Result.err(owned.getError());
        }
        Assignment assignment = owned.getValue();

        boolean changesSubtype = request.subtype() != null && request.subtype() != assignment.getSubtype();
        if ((changesSubtype || request.questions() != null) && submissionRepository.existsByAssignmentId(assignmentId)) {
            return Result.err(AssignmentFailure.of(changesSubtype
                    ? AssignmentError.SUBTYPE_LOCKED
                    : AssignmentError.QUESTIONS_LOCKED));
        }

        List<Question> replacement = null;
        if (request.questions() != null) {
            Result<List<Question>, AssignmentFailure> built = buildQuestions(request.questions());
            if (built.isErr()) {
                return Result.err(built.getError());
            }
            replacement = built.getValue();
        }

        if (request.title() != null) {
            assignment.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            assignment.setDescription(request.description());
        }
        if (changesSubtype) {
            assignment.setSubtype(request.subtype());
        }
        if (request.points() != null) {
            assignment.setPoints(request.points());
        }
        if (request.dueDate() != null) {
            assignment.setDueDate(request.dueDate());
        }
        if (request.published() != null) {
            assignment.setPublished(request.published());
        }
        String starterCode = request.starterCode() != null ? request.starterCode() : assignment.getStarterCode();
        assignment.setStarterCode(starterCodeFor(assignment.getSubtype(), starterCode));
        if (replacement != null) {
            assignment.replaceQuestions(replacement);
        }

        Assignment saved = assignmentRepository.saveAndFlush(assignment);
        log.info("Instructor {} updated assignment {}", instructorId, assignmentId);
        return Result.ok(assignmentMapper.toDto(saved, true, false));
    }

    @Override
    @Transactional
    public Result<Void, AssignmentFailure> deleteAssignment(UUID assignmentId, UUID instructorId) {
        Result<Assignment, AssignmentFailure> owned = loadOwned(assignmentId, instructorId);
        if (owned.isErr()) {
            return Result.err(owned.getError());
        }
        Assignment assignment = owned.getValue();
        if (submissionRepository.existsByAssignmentId(assignmentId)) {
            return Result.err(AssignmentFailure.of(AssignmentError.HAS_SUBMISSIONS));
        }

        // stored objects go first: if one cannot be removed the assignment is kept and the delete can be retried
        int failed = 0;
        for (AssignmentAttachment attachment : assignment.getAttachments()) {
            try {
                fileStorage.delete(attachment.getStorageKey());
            } catch (StorageException ex) {
                log.error("Failed to delete attachment {} of assignment {}", attachment.getStorageKey(), assignmentId, ex);
                failed++;
            }
        }
        if (failed > 0) {
            return Result.err(AssignmentFailure.of(AssignmentError.ATTACHMENT_CLEANUP_FAILED,
                    "Could not remove " + failed + " of " + assignment.getAttachments().size()
                            + " attached files; the assignment was kept. Please retry."));
        }

        assignmentRepository.delete(assignment);
        assignmentRepository.flush();
        log.info("Instructor {} deleted assignment {}", instructorId, assignmentId);
        return Result.ok(null);
    }

    @Override
    @Transactional
    public Result<QuestionDto, AssignmentFailure> addQuestion(UUID assignmentId, UUID instructorId,
                                                              QuestionRequest request) {
        Result<Assignment, AssignmentFailure> editable = loadEditable(assignmentId, instructorId);
        if (editable.isErr()) {
            return Result.err(editable.getError());
        }
        Assignment assignment = editable.getValue();

        Result<Question, AssignmentFailure> built = buildQuestion(request, assignment.getQuestions().size());
        if (built.isErr()) {
            return Result.err(built.getError());
        }
        Question question = built.getValue();
        assignment.addQuestion(question);
        assignmentRepository.saveAndFlush(assignment);
        log.info("Instructor {} added question {} to assignment {}", instructorId, question.getId(), assignmentId);
        return Result.ok(assignmentMapper.toQuestionDto(question, true));
    }

    @Override
    @Transactional
    public Result<QuestionDto, AssignmentFailure> updateQuestion(UUID assignmentId, UUID questionId,
                                                                 UUID instructorId, QuestionRequest request) {
        Result<Assignment, AssignmentFailure> editable = loadEditable(assignmentId, instructorId);
        if (editable.isErr()) {
            return Result.err(editable.getError());
        }
        Optional<Question> found = findQuestion(editable.getValue(), questionId);
        if (found.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.QUESTION_NOT_FOUND));
        }
        Question question = found.get();

        Result<Question, AssignmentFailure> built = buildQuestion(request, question.getPosition());
        if (built.isErr()) {
            return Result.err(built.getError());
        }
        assignmentMapper.applyQuestion(request, question);
        assignmentRepository.saveAndFlush(editable.getValue());
        log.info("Instructor {} updated question {} of assignment {}", instructorId, questionId, assignmentId);
        return Result.ok(assignmentMapper.toQuestionDto(question, true));
    }

    @Override
    @Transactional
    public Result<Void, AssignmentFailure> deleteQuestion(UUID assignmentId, UUID questionId, UUID instructorId) {
        Result<Assignment, AssignmentFailure> editable = loadEditable(assignmentId, instructorId);
        if (editable.isErr()) {
            return Result.err(editable.getError());
        }
        Assignment assignment = editable.getValue();
        Optional<Question> found = findQuestion(assignment, questionId);
        if (found.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.QUESTION_NOT_FOUND));
        }

        assignment.removeQuestion(found.get());
        assignmentRepository.saveAndFlush(assignment);
        log.info("Instructor {} removed question {} from assignment {}", instructorId, questionId, assignmentId);
        return Result.ok(null);
    }

    private Result<Assignment, AssignmentFailure> loadOwned(UUID assignmentId, UUID instructorId) {
        return assignmentRepository.findWithCourseById(assignmentId)
                .filter(a -> a.getCourse().isOwnedBy(instructorId))
                .<Result<Assignment, AssignmentFailure>>map(Result::ok)
                .orElseGet(() -> Result.err(AssignmentFailure.of(AssignmentError.ASSIGNMENT_NOT_OWNED)));
    }

    /**
     * Owned assignment whose questions may still change: graded submissions refer to them.
     */
    private Result<Assignment, AssignmentFailure> loadEditable(UUID assignmentId, UUID instructorId) {
        return loadOwned(assignmentId, instructorId).flatMap(assignment ->
                submissionRepository.existsByAssignmentId(assignmentId)
                        ? Result.err(AssignmentFailure.of(AssignmentError.QUESTIONS_LOCKED))
                        : Result.ok(assignment));
    }

    private Result<List<Question>, AssignmentFailure> buildQuestions(List<QuestionRequest> requests) {
        List<Question> questions = new ArrayList<>();
        for (QuestionRequest request : requests) {
            Result<Question, AssignmentFailure> built = buildQuestion(request, questions.size());
            if (built.isErr()) {
                return Result.err(built.getError());
            }
            questions.add(built.getValue());
        }
        return Result.ok(questions);
    }

    private Result<Question, AssignmentFailure> buildQuestion(QuestionRequest request, int index) {
        Question question = new Question();
        assignmentMapper.applyQuestion(request, question);
        List<String> problems = graderFactory.getGrader(question.getType()).validateDefinition(question);
        if (!problems.isEmpty()) {
            return Result.err(AssignmentFailure.of(AssignmentError.INVALID_QUESTION,
                    "Question " + (index + 1) + " (" + question.getType() + "): " + String.join("; ", problems)));
        }
        return Result.ok(question);
    }

    private Assignment attach(Assignment assignment, MultipartFile upload) {
        String key = storageProperties.getAttachmentKeyPrefix() + "/" + assignment.getId() + "/"
                + UUID.randomUUID() + "-" + UploadNames.keyName(upload.getOriginalFilename());
        String storedKey = null;
        try (InputStream content = upload.getInputStream()) {
            StoredObject stored = fileStorage.store(key, content, upload.getSize(),
                    UploadNames.contentType(upload.getContentType()));
            storedKey = stored.key();
            assignment.addAttachment(toAttachment(upload, stored));
            return assignmentRepository.saveAndFlush(assignment);
        } catch (StorageException | IOException | DataAccessException ex) {
            log.error("Attachment upload for assignment {} failed, rolling back assignment", assignment.getId(), ex);
            if (storedKey != null) {
                discardStoredObject(assignment.getId(), storedKey);
            }
            String message = ex instanceof DataAccessException
                    ? AssignmentError.ATTACHMENT_UPLOAD_FAILED.defaultMessage()
                    : "Failed to upload attachment: " + ex.getMessage();
            throw new UploadFailedException(AssignmentError.ATTACHMENT_UPLOAD_FAILED.name(), message, ex);
        }
    }

    private void discardStoredObject(UUID assignmentId, String key) {
        try {
            fileStorage.delete(key);
        } catch (StorageException ex) {
            log.error("Orphaned object {} left in storage after failed assignment {}", key, assignmentId, ex);
        }
    }

    private AssignmentAttachment toAttachment(MultipartFile upload, StoredObject stored) {
        AssignmentAttachment attachment = new AssignmentAttachment();
        attachment.setOriginalName(UploadNames.displayName(upload.getOriginalFilename()));
        attachment.setMimeType(UploadNames.contentType(upload.getContentType()));
        attachment.setFileType(StoredFileType.fromMimeType(attachment.getMimeType()));
        attachment.setSize(upload.getSize());
        attachment.setStorageKey(stored.key());
        attachment.setPublicUrl(stored.publicUrl());
        attachment.setUploadedAt(LocalDateTime.now(utcClock));
        return attachment;
    }

    private boolean isEnrolled(UUID courseId, UUID studentId) {
        return enrollmentRepository.existsByCourseIdAndStudentIdAndStatus(courseId, studentId, EnrollmentStatus.ACTIVE);
    }

    private static Optional<Question> findQuestion(Assignment assignment, UUID questionId) {
        return assignment.getQuestions().stream()
                .filter(q -> questionId.equals(q.getId()))
                .findFirst();
    }

    private static String starterCodeFor(AssignmentSubtype subtype, String starterCode) {
        return subtype == AssignmentSubtype.CODE_SANDBOX ? starterCode : null;
    }
}
