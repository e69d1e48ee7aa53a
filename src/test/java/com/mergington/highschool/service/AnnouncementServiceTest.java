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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AnnouncementServiceTest {

    @Mock
    private AnnouncementRepository announcementRepository;

    @Mock
    private CredentialVerifier credentialVerifier;

    @InjectMocks
    private AnnouncementService announcementService;

    private final String teacher = "mchen";

    private AnnouncementRequestDTO request(String message, String expirationDate, String startDate) {
        return AnnouncementRequestDTO.builder()
                .username(teacher)
                .message(message)
                .expirationDate(expirationDate)
                .startDate(startDate)
                .build();
    }

    @Test
    void getAnnouncements_ShouldReturnExpiredAndActive() {
        when(announcementRepository.findAll()).thenReturn(List.of(
                Announcement.builder().id("a1").message("Old").expirationDate("2000-01-01").build(),
                Announcement.builder().id("a2").message("New").expirationDate("2099-01-01").startDate("2098-12-01").build()));

        List<AnnouncementDTO> result = announcementService.getAnnouncements();

        assertEquals(2, result.size());
        assertEquals("a1", result.get(0).getId());
        assertEquals("2098-12-01", result.get(1).getStartDate());
    }

    @Test
    void createAnnouncement_ShouldInsertAndReturnAssignedId() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.insert(any(Announcement.class))).thenAnswer(inv -> {
            Announcement a = inv.getArgument(0);
            a.setId("665f1c2e9b1d4a0012345678");
            return a;
        });

        AnnouncementDTO created = announcementService.createAnnouncement(request("Club fair on Friday", "2099-01-01", ""));

        assertEquals("665f1c2e9b1d4a0012345678", created.getId());
        assertEquals("Club fair on Friday", created.getMessage());
        assertEquals("2099-01-01", created.getExpirationDate());
        assertNull(created.getStartDate());
    }

    @Test
    void createAnnouncement_ShouldRejectUnknownUser() {
        when(credentialVerifier.verify(teacher)).thenReturn(false);

        UnauthorizedException ex = assertThrows(UnauthorizedException.class,
                () -> announcementService.createAnnouncement(request("M", "2099-01-01", null)));

        assertEquals("Authentication required", ex.getMessage());
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void createAnnouncement_ShouldRequireMessageAndExpiration() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);

        BadRequestException noMessage = assertThrows(BadRequestException.class,
                () -> announcementService.createAnnouncement(request("", "2099-01-01", null)));
        BadRequestException noExpiration = assertThrows(BadRequestException.class,
                () -> announcementService.createAnnouncement(request("M", null, null)));

        assertEquals("Message and expiration date required", noMessage.getMessage());
        assertEquals("Message and expiration date required", noExpiration.getMessage());
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void createAnnouncement_ShouldRejectMalformedDates() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);

        for (AnnouncementRequestDTO bad : List.of(
                request("M", "2099/01/01", null),
                request("M", "2024-02-30", null),
                request("M", "2099-01-01", "tomorrow"))) {
            BadRequestException ex = assertThrows(BadRequestException.class,
                    () -> announcementService.createAnnouncement(bad));
            assertEquals("Invalid date format (YYYY-MM-DD)", ex.getMessage());
        }
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void updateAnnouncement_ShouldFail_WhenIdUnknown() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> announcementService.updateAnnouncement("missing", request("M", "2099-01-01", null)));
        verify(announcementRepository, never()).save(any());
    }

    @Test
    void updateAnnouncement_ShouldRejectMalformedDate() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);

        assertThrows(BadRequestException.class,
                () -> announcementService.updateAnnouncement("a1", request("M", "2099/01/01", null)));
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void updateAnnouncement_ShouldKeepStartDate_WhenOmitted() {
        Announcement stored = Announcement.builder()
                .id("a1").message("Old").expirationDate("2099-01-01").startDate("2098-12-01").build();
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.findById("a1")).thenReturn(Optional.of(stored));
        when(announcementRepository.save(any(Announcement.class))).thenAnswer(inv -> inv.getArgument(0));

        AnnouncementDTO updated = announcementService.updateAnnouncement("a1", request("New", "2099-02-01", null));

        ArgumentCaptor<Announcement> saved = ArgumentCaptor.forClass(Announcement.class);
        verify(announcementRepository).save(saved.capture());
        assertEquals("New", saved.getValue().getMessage());
        assertEquals("2099-02-01", saved.getValue().getExpirationDate());
        assertEquals("2098-12-01", saved.getValue().getStartDate());
        assertEquals("a1", updated.getId());
    }

    @Test
    void updateAnnouncement_ShouldAcceptEmptyMessage() {
        Announcement stored = Announcement.builder()
                .id("a1").message("Old").expirationDate("2099-01-01").build();
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.findById("a1")).thenReturn(Optional.of(stored));
        when(announcementRepository.save(any(Announcement.class))).thenAnswer(inv -> inv.getArgument(0));

        AnnouncementDTO updated = announcementService.updateAnnouncement("a1", request("", "2099-03-01", null));

        assertEquals("", updated.getMessage());
        assertEquals("2099-03-01", updated.getExpirationDate());
    }

    @Test
    void updateAnnouncement_ShouldReportDateFormat_WhenExpirationEmpty() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);

        BadRequestException empty = assertThrows(BadRequestException.class,
                () -> announcementService.updateAnnouncement("a1", request("M", "", null)));
        BadRequestException missing = assertThrows(BadRequestException.class,
                () -> announcementService.updateAnnouncement("a1", request("M", null, null)));

        assertEquals("Invalid date format (YYYY-MM-DD)", empty.getMessage());
        assertEquals("Invalid date format (YYYY-MM-DD)", missing.getMessage());
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void deleteAnnouncement_ShouldRejectUnknownUser() {
        when(credentialVerifier.verify(null)).thenReturn(false);

        assertThrows(UnauthorizedException.class, () -> announcementService.deleteAnnouncement("a1", null));
        verifyNoInteractions(announcementRepository);
    }

    @Test
    void deleteAnnouncement_ShouldFail_WhenIdUnknown() {
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.existsById("missing")).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> announcementService.deleteAnnouncement("missing", teacher));
        verify(announcementRepository, never()).deleteById(anyString());
    }

    @Test
    void announcementLifecycle_CreateListUpdateDelete() {
        Map<String, Announcement> store = new LinkedHashMap<>();
        when(credentialVerifier.verify(teacher)).thenReturn(true);
        when(announcementRepository.insert(any(Announcement.class))).thenAnswer(inv -> {
            Announcement a = inv.getArgument(0);
            a.setId("id-" + (store.size() + 1));
            store.put(a.getId(), a);
            return a;
        });
        when(announcementRepository.findAll()).thenAnswer(inv -> new ArrayList<>(store.values()));
        when(announcementRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        when(announcementRepository.save(any(Announcement.class))).thenAnswer(inv -> {
            Announcement a = inv.getArgument(0);
            store.put(a.getId(), a);
            return a;
        });
        when(announcementRepository.existsById(anyString()))
                .thenAnswer(inv -> store.containsKey(inv.<String>getArgument(0)));
        doAnswer(inv -> store.remove(inv.<String>getArgument(0)))
                .when(announcementRepository).deleteById(anyString());

        AnnouncementDTO created = announcementService.createAnnouncement(request("M", "2099-01-01", null));
        String id = created.getId();
        assertFalse(id.isEmpty());
        assertTrue(announcementService.getAnnouncements().stream().anyMatch(a -> a.getId().equals(id)));

        AnnouncementDTO updated = announcementService.updateAnnouncement(id, request("M2", "2099-01-01", null));
        assertEquals("M2", updated.getMessage());
        assertEquals("2099-01-01", updated.getExpirationDate());
        assertNull(updated.getStartDate());

        AnnouncementDeletedDTO deleted = announcementService.deleteAnnouncement(id, teacher);
        assertTrue(deleted.isDeleted());
        assertEquals(id, deleted.getId());
        assertTrue(announcementService.getAnnouncements().isEmpty());

        assertThrows(ResourceNotFoundException.class, () -> announcementService.deleteAnnouncement(id, teacher));
    }
}
