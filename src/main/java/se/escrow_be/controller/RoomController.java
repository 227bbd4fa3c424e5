package se.escrow_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.escrow_be.dto.request.RoomCreateRequest;
import se.escrow_be.dto.response.ApiResponse;
import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.dto.response.RoomSummaryResponse;
import se.escrow_be.dto.response.SignatureAuditResponse;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.RoomStatus;
import se.escrow_be.service.RoomService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rooms")
@Tag(name = "Escrow Rooms",
     description = "Room creation and lookup. All state transitions after creation happen over the room WebSocket.")
@RequiredArgsConstructor
@Slf4j
public class RoomController {

    private final RoomService roomService;

    @Operation(
            summary = "Create a room",
            description = "A registered seller opens a room for a fixed amount. Returns the room snapshot with its phrase."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Room created",
                    content = @Content(schema = @Schema(implementation = RoomResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid amount"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "User is not a seller"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown seller")
    })
    @PostMapping("/create")
    public ResponseEntity<ApiResponse<RoomResponse>> createRoom(
            @Parameter(description = "Seller id and amount", required = true)
            @Valid @RequestBody RoomCreateRequest request) {
        RoomResponse room = roomService.createRoom(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Room created successfully", room));
    }

    @Operation(summary = "List rooms", description = "Public summaries of rooms, by default those still waiting for a buyer.")
    @GetMapping
    public ResponseEntity<ApiResponse<List<RoomSummaryResponse>>> listRooms(
            @Parameter(description = "Status filter", example = "WAITING_FOR_BUYER")
            @RequestParam(required = false) RoomStatus status) {
        return ResponseEntity.ok(ApiResponse.success(roomService.listRooms(status)));
    }

    @Operation(summary = "Get a room by phrase")
    @GetMapping("/{roomPhrase}")
    public ResponseEntity<ApiResponse<RoomResponse>> getRoom(@PathVariable String roomPhrase) {
        return ResponseEntity.ok(ApiResponse.success(roomService.getRoom(roomPhrase)));
    }

    @Operation(
            summary = "Audit contract signatures",
            description = "Re-verifies every stored signature of the room's contract against the signer's registered key."
    )
    @GetMapping("/{roomPhrase}/contract/audit")
    public ResponseEntity<ApiResponse<Map<Party, SignatureAuditResponse>>> auditContract(@PathVariable String roomPhrase) {
        return ResponseEntity.ok(ApiResponse.success(roomService.auditContract(roomPhrase)));
    }
}
