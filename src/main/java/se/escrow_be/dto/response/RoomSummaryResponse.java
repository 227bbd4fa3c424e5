package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.RoomStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomSummaryResponse {
    private String roomPhrase;
    private String sellerId;
    private BigDecimal amount;
    private RoomStatus status;
    private LocalDateTime createdAt;
}
