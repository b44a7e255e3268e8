package uk.gegc.intellicode.features.assignment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.intellicode.features.assignment.api.dto.*;
import uk.gegc.intellicode.features.assignment.application.AssignmentService;
import uk.gegc.intellicode.features.assignment.domain.service.AssignmentFailure;
import uk.gegc.intellicode.features.auth.infra.security.AuthenticatedUser;
import uk.gegc.intellicode.shared.result.Result;

import java.util.List;
import java.util.UUID;

@Tag(name = "Assignments", description = "Authoring assignments and their questions")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearerAuth")
public class AssignmentController {

    private final AssignmentService assignmentService;

    @Operation(summary = "Create an assignment",
            description = "Only the instructor of the module's course may create assignments. "
                    + "New assignments are published unless stated otherwise.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assignment created",
                    content = @Content(schema = @Schema(implementation = AssignmentDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failure or incomplete question",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Module not found or not owned by the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping(value = "/modules/{moduleId}/assignments", consumes = MediaType.APPLICATION_JSON_VALUE)
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<AssignmentDto> createAssignment(
            @Parameter(description = "Module UUID", required = true) @PathVariable UUID moduleId,
            @RequestBody @Valid CreateAssignmentRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        AssignmentDto dto = unwrap(assignmentService.createAssignment(moduleId, user.id(), request, null));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Create an assignment with an attached file",
            description = "The assignment goes in the 'assignment' part as JSON, the file in 'attachment'.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assignment and attachment stored",
                    content = @Content(schema = @Schema(implementation = AssignmentDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failure or attachment too large",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Attachment upload failed; nothing was kept",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping(value = "/modules/{moduleId}/assignments/with-file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<AssignmentDto> createAssignmentWithFile(
            @PathVariable UUID moduleId,
            @RequestPart("assignment") @Valid CreateAssignmentRequest request,
            @RequestPart(value = "attachment", required = false) MultipartFile attachment,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        AssignmentDto dto = unwrap(assignmentService.createAssignment(moduleId, user.id(), request, attachment));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "List the assignments of a module",
            description = "Instructors see every assignment with its answer key; enrolled students see "
                    + "published assignments only.")
    @ApiResponse(responseCode = "200", description = "Assignments, oldest first",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AssignmentDto.class))))
    @GetMapping("/modules/{moduleId}/assignments")
    public ResponseEntity<List<AssignmentDto>> getModuleAssignments(
            @PathVariable UUID moduleId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(assignmentService.getModuleAssignments(moduleId, user.id())));
    }

    @Operation(summary = "Get an assignment",
            description = "Correct answers are only included for the course instructor.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignment found",
                    content = @Content(schema = @Schema(implementation = AssignmentDto.class))),
            @ApiResponse(responseCode = "404", description = "Assignment not found or not visible to the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<AssignmentDto> getAssignment(
            @PathVariable UUID assignmentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(assignmentService.getAssignment(assignmentId, user.id())));
    }

    @Operation(summary = "Update an assignment",
            description = "Omitted fields keep their value. Questions and the assignment type are locked "
                    + "once students have submitted.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assignment updated",
                    content = @Content(schema = @Schema(implementation = AssignmentDto.class))),
            @ApiResponse(responseCode = "409", description = "Change not allowed after submissions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/assignments/{assignmentId}")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<AssignmentDto> updateAssignment(
            @PathVariable UUID assignmentId,
            @RequestBody @Valid UpdateAssignmentRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(assignmentService.updateAssignment(assignmentId, user.id(), request)));
    }

    @Operation(summary = "Delete an assignment")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Assignment deleted"),
            @ApiResponse(responseCode = "409", description = "Assignment has submissions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Attached files could not be removed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/assignments/{assignmentId}")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<Void> deleteAssignment(
            @PathVariable UUID assignmentId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        unwrap(assignmentService.deleteAssignment(assignmentId, user.id()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add a question to an assignment")
    @PostMapping("/assignments/{assignmentId}/questions")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<QuestionDto> addQuestion(
            @PathVariable UUID assignmentId,
            @RequestBody @Valid QuestionRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        QuestionDto dto = unwrap(assignmentService.addQuestion(assignmentId, user.id(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Replace a question's definition")
    @PutMapping("/assignments/{assignmentId}/questions/{questionId}")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<QuestionDto> updateQuestion(
            @PathVariable UUID assignmentId,
            @PathVariable UUID questionId,
            @RequestBody @Valid QuestionRequest request,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        return ResponseEntity.ok(unwrap(assignmentService.updateQuestion(assignmentId, questionId, user.id(), request)));
    }

    @Operation(summary = "Remove a question from an assignment")
    @DeleteMapping("/assignments/{assignmentId}/questions/{questionId}")
    @PreAuthorize("hasRole('TEACHER')")
    public ResponseEntity<Void> deleteQuestion(
            @PathVariable UUID assignmentId,
            @PathVariable UUID questionId,
            @AuthenticationPrincipal AuthenticatedUser user
    ) {
        unwrap(assignmentService.deleteQuestion(assignmentId, questionId, user.id()));
        return ResponseEntity.noContent().build();
    }

    private static <T> T unwrap(Result<T, AssignmentFailure> result) {
        return result.orElseThrow(AssignmentFailure::toException);
    }
}
