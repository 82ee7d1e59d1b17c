package guraa.sitephoto.controller;

import guraa.sitephoto.exception.StorageFailureException;
import guraa.sitephoto.model.IngestRequest;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.PlacementOutcome;
import guraa.sitephoto.service.CaptionHints;
import guraa.sitephoto.service.PhotoCatalog;
import guraa.sitephoto.service.PhotoIngestService;
import guraa.sitephoto.service.SiteRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PhotoController.class)
@Import(CaptionHints.class)
class PhotoControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PhotoIngestService photoIngestService;

    @MockBean
    private PhotoCatalog photoCatalog;

    @MockBean
    private SiteRegistry siteRegistry;

    @Test
    void shouldStoreUploadedPhoto() throws Exception {
        // Given
        when(photoIngestService.ingest(any())).thenReturn(PlacementOutcome.stored(
                "2024-05/ALPHA/grass_cutting/before/a.jpg", "ALPHA", "grass_cutting", Phase.BEFORE));
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1, 2, 3});

        // When / Then
        mockMvc.perform(multipart("/api/photos")
                        .file(file)
                        .param("capturedAt", "2024-05-05T09:00:00Z")
                        .param("site", "ALPHA")
                        .param("phase", "before"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.stored").value(true))
                .andExpect(jsonPath("$.storedPath").value("2024-05/ALPHA/grass_cutting/before/a.jpg"))
                .andExpect(jsonPath("$.phase").value("BEFORE"));

        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(photoIngestService).ingest(captor.capture());
        assertEquals(Instant.parse("2024-05-05T09:00:00Z"), captor.getValue().getCapturedAt());
        assertEquals(Phase.BEFORE, captor.getValue().getPhase());
        assertEquals("a.jpg", captor.getValue().getOriginalFilename());
    }

    @Test
    void shouldAnswerRejectedPhotoWithReason() throws Exception {
        when(photoIngestService.ingest(any())).thenReturn(
                PlacementOutcome.rejected("ALPHA", "grass_cutting", "Captured at 13:30"));
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1});

        mockMvc.perform(multipart("/api/photos").file(file))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.stored").value(false))
                .andExpect(jsonPath("$.phase").value("REJECTED"))
                .andExpect(jsonPath("$.rejectionReason").value("Captured at 13:30"))
                .andExpect(jsonPath("$.storedPath").doesNotExist());
    }

    @Test
    void shouldNamePhotoWhenStorageFails() throws Exception {
        when(photoIngestService.ingest(any())).thenThrow(
                new StorageFailureException("a.jpg", "disk full", null));
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1});

        mockMvc.perform(multipart("/api/photos").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.photo").value("a.jpg"));
    }

    @Test
    void shouldRejectMalformedCaptureTime() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1});

        mockMvc.perform(multipart("/api/photos").file(file).param("capturedAt", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void shouldAcceptMalayPhaseWords() throws Exception {
        // Given
        when(photoIngestService.ingest(any())).thenReturn(PlacementOutcome.stored(
                "2024-05/ALPHA/grass_cutting/before/a.jpg", "ALPHA", "grass_cutting", Phase.BEFORE));
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1});

        // When
        mockMvc.perform(multipart("/api/photos").file(file).param("site", "ALPHA").param("phase", "sebelum"))
                .andExpect(status().isCreated());
        mockMvc.perform(multipart("/api/photos").file(file).param("site", "ALPHA").param("phase", "Selepas"))
                .andExpect(status().isCreated());

        // Then
        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(photoIngestService, times(2)).ingest(captor.capture());
        assertEquals(Phase.BEFORE, captor.getAllValues().get(0).getPhase());
        assertEquals(Phase.AFTER, captor.getAllValues().get(1).getPhase());
    }

    @Test
    void shouldRejectUnknownPhase() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[]{1});

        mockMvc.perform(multipart("/api/photos").file(file).param("phase", "rejected"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldListCatalog() throws Exception {
        Map<String, List<String>> catalog = new LinkedHashMap<>();
        catalog.put("2024-05", List.of("ALPHA", "BRAVO"));
        when(photoCatalog.listMonthsAndSites()).thenReturn(catalog);

        mockMvc.perform(get("/api/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['2024-05'][1]").value("BRAVO"));
    }

    @Test
    void shouldAddSite() throws Exception {
        when(siteRegistry.addSite("foxtrot", "f")).thenReturn(true);

        mockMvc.perform(post("/api/sites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"foxtrot\",\"shortcut\":\"f\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.site").value("FOXTROT"))
                .andExpect(jsonPath("$.added").value(true));
    }

    @Test
    void shouldRequireSiteName() throws Exception {
        mockMvc.perform(post("/api/sites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shortcut\":\"f\"}"))
                .andExpect(status().isBadRequest());
    }
}
