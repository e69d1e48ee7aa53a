package com.mergington.highschool.controller;

import com.mergington.highschool.dto.AnnouncementDTO;
import com.mergington.highschool.dto.AnnouncementDeleteRequestDTO;
import com.mergington.highschool.dto.AnnouncementDeletedDTO;
import com.mergington.highschool.dto.AnnouncementRequestDTO;
import com.mergington.highschool.service.AnnouncementService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/activities/announcements")
@RequiredArgsConstructor
@CrossOrigin("*")
public class AnnouncementController {

    private final AnnouncementService announcementService;

    @GetMapping
    public ResponseEntity<List<AnnouncementDTO>> getAnnouncements() {
        return ResponseEntity.ok(announcementService.getAnnouncements());
    }

    @PostMapping
    public ResponseEntity<AnnouncementDTO> createAnnouncement(@RequestBody AnnouncementRequestDTO request) {
        return ResponseEntity.ok(announcementService.createAnnouncement(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AnnouncementDTO> updateAnnouncement(@PathVariable String id,
            @RequestBody AnnouncementRequestDTO request) {
        return ResponseEntity.ok(announcementService.updateAnnouncement(id, request));
    }

    /**
     * The acting teacher is sent in the request body; a missing body is treated as anonymous.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<AnnouncementDeletedDTO> deleteAnnouncement(@PathVariable String id,
            @RequestBody(required = false) AnnouncementDeleteRequestDTO request) {
        String username = request != null ? request.getUsername() : null;
        return ResponseEntity.ok(announcementService.deleteAnnouncement(id, username));
    }
}
