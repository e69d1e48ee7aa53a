package com.mergington.highschool.service;

import com.mergington.highschool.dto.AnnouncementDTO;
import com.mergington.highschool.dto.AnnouncementDeletedDTO;
import com.mergington.highschool.dto.AnnouncementRequestDTO;
import com.mergington.highschool.exception.BadRequestException;
import com.mergington.highschool.exception.ResourceNotFoundException;
import com.mergington.highschool.exception.UnauthorizedException;
import com.mergington.highschool.model.Announcement;
import com.mergington.highschool.repository.AnnouncementRepository;
import com.mergington.highschool.security.CredentialVerifier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AnnouncementService {

    private static final Logger logger = LoggerFactory.getLogger(AnnouncementService.class);

    // Strict so that 2024-02-30 is rejected instead of being resolved to the end of the month
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private final AnnouncementRepository announcementRepository;
    private final CredentialVerifier credentialVerifier;

    /**
     * Returns every announcement, expired ones included.
     */
    public List<AnnouncementDTO> getAnnouncements() {
        return announcementRepository.findAll().stream()
                .map(this::mapToDTO)
                .collect(Collectors.toList());
    }

    public AnnouncementDTO createAnnouncement(AnnouncementRequestDTO request) {
        requireTeacher(request.getUsername());
        requireMessageAndExpiration(request);
        validateDates(request);

        Announcement announcement = Announcement.builder()
                .message(request.getMessage())
                .expirationDate(request.getExpirationDate())
                .startDate(hasText(request.getStartDate()) ? request.getStartDate() : null)
                .build();

        announcement = announcementRepository.insert(announcement);
        logger.info("Teacher {} created announcement {}", request.getUsername(), announcement.getId());
        return mapToDTO(announcement);
    }

    /**
     * Overwrites message and expiration date. The start date is only overwritten
     * when the request carries one; omitting it keeps the stored value. Only the
     * dates are validated, so an empty message is stored as given.
     */
    public AnnouncementDTO updateAnnouncement(String id, AnnouncementRequestDTO request) {
        requireTeacher(request.getUsername());
        validateDates(request);

        Announcement announcement = announcementRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Announcement not found"));

        announcement.setMessage(request.getMessage());
        announcement.setExpirationDate(request.getExpirationDate());
        if (hasText(request.getStartDate())) {
            announcement.setStartDate(request.getStartDate());
        }

        announcement = announcementRepository.save(announcement);
        logger.info("Teacher {} updated announcement {}", request.getUsername(), id);
        return mapToDTO(announcement);
    }

    public AnnouncementDeletedDTO deleteAnnouncement(String id, String username) {
        requireTeacher(username);

        if (!announcementRepository.existsById(id)) {
            throw new ResourceNotFoundException("Announcement not found");
        }

        announcementRepository.deleteById(id);
        logger.info("Teacher {} deleted announcement {}", username, id);
        return new AnnouncementDeletedDTO(id, true);
    }

    private void requireTeacher(String username) {
        if (!credentialVerifier.verify(username)) {
            logger.warn("Rejected announcement change for unknown user {}", username);
            throw new UnauthorizedException("Authentication required");
        }
    }

    private void requireMessageAndExpiration(AnnouncementRequestDTO request) {
        if (!hasText(request.getMessage()) || !hasText(request.getExpirationDate())) {
            throw new BadRequestException("Message and expiration date required");
        }
    }

    private void validateDates(AnnouncementRequestDTO request) {
        if (!isIsoDate(request.getExpirationDate())
                || (hasText(request.getStartDate()) && !isIsoDate(request.getStartDate()))) {
            throw new BadRequestException("Invalid date format (YYYY-MM-DD)");
        }
    }

    private boolean isIsoDate(String value) {
        if (value == null) {
            return false;
        }
        try {
            LocalDate.parse(value, DATE_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private AnnouncementDTO mapToDTO(Announcement announcement) {
        return AnnouncementDTO.builder()
                .id(announcement.getId() != null ? announcement.getId() : "")
                .message(announcement.getMessage())
                .expirationDate(announcement.getExpirationDate())
                .startDate(announcement.getStartDate())
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
