package se.escrow_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import se.escrow_be.pojo.Room;
import se.escrow_be.pojo.enums.RoomStatus;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface RoomRepository extends JpaRepository<Room, String> {

    List<Room> findByStatusOrderByCreatedAtDesc(RoomStatus status);

    /**
     * Phrases of rooms whose inactivity deadline has passed. Terminal rooms carry no deadline.
     */
    @Query("select r.roomPhrase from Room r where r.inactivityDeadline is not null and r.inactivityDeadline <= :now")
    List<String> findRoomPhrasesInactiveSince(@Param("now") LocalDateTime now);
}
