package guraa.sitephoto.service;

import guraa.sitephoto.config.AppProperties;
import guraa.sitephoto.config.PhaseWindow;
import guraa.sitephoto.exception.PhotoNotFoundException;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.Photo;
import guraa.sitephoto.model.ReportSelector;
import guraa.sitephoto.support.InMemoryPhotoStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PhotoCatalogTest {

    private InMemoryPhotoStore store;
    private PhotoCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryPhotoStore();
        catalog = new PhotoCatalog(store, PhaseWindow.of(12, 15, "UTC"), new AppProperties());

        write("2024-05/ALPHA/grass_cutting/before/alpha_grass_cutting_before_20240503_090000_x_photo.jpg");
        write("2024-05/ALPHA/grass_cutting/before/alpha_grass_cutting_before_20240520_080000_y_photo.jpg");
        write("2024-05/ALPHA/grass_cutting/after/alpha_grass_cutting_after_20240503_160000_z_photo.jpg");
        write("2024-05/ALPHA/grass_cutting/after/notes.txt");
        write("2024-05/BRAVO/drainage_cleaning/after/bravo_drainage_cleaning_after_20240504_170000_q_photo.jpg");
        write("2024-05/CHARLIE/unknown_task/before/c.jpg");
        write("2024-06/ALPHA/grass_cutting/before/alpha_grass_cutting_before_20240601_070000_w_photo.jpg");
        write("exports/ALPHA/grass_cutting/before/ignored.jpg");
    }

    @Test
    void shouldListMonthsWithSitesThatHaveKnownTasks() throws Exception {
        // When
        Map<String, List<String>> months = catalog.listMonthsAndSites();

        // Then
        assertEquals(List.of("2024-05", "2024-06"), List.copyOf(months.keySet()));
        assertEquals(List.of("ALPHA", "BRAVO"), months.get("2024-05"));
        assertEquals(List.of("ALPHA"), months.get("2024-06"));
    }

    @Test
    void shouldLoadWholeGroupAcrossMonths() throws Exception {
        // When
        List<Photo> photos = catalog.loadGroup(new ReportSelector("ALPHA", "grass_cutting", null, null));

        // Then
        assertEquals(4, photos.size());
        assertEquals(3, photos.stream().filter(p -> p.getPhase() == Phase.BEFORE).count());
        List<String> ids = photos.stream().map(Photo::getId).collect(Collectors.toList());
        assertEquals(ids.stream().sorted().collect(Collectors.toList()), ids);
    }

    @Test
    void shouldLimitGroupToDateRange() throws Exception {
        // Given
        ReportSelector firstWeek = new ReportSelector("ALPHA", "grass_cutting",
                LocalDate.parse("2024-05-01"), LocalDate.parse("2024-05-07"));

        // When
        List<Photo> photos = catalog.loadGroup(firstWeek);

        // Then
        assertEquals(2, photos.size());
        assertTrue(photos.stream().allMatch(p -> p.getCapturedAt().toLocalDate().isBefore(LocalDate.parse("2024-05-08"))));
    }

    @Test
    void shouldLoadSingleMonth() throws Exception {
        List<Photo> photos = catalog.loadGroup(ReportSelector.forMonth("ALPHA", "grass_cutting", YearMonth.of(2024, 6)));

        assertEquals(1, photos.size());
        assertEquals(LocalDateTime.parse("2024-06-01T07:00:00"), photos.get(0).getCapturedAt());
    }

    @Test
    void shouldSkipDirectoriesThatLookLikeImpossibleMonths() throws Exception {
        // Given
        write("2024-13/ALPHA/grass_cutting/before/alpha_grass_cutting_before_20241301_090000_v_photo.jpg");
        write("0000-00/ALPHA/grass_cutting/after/stray.jpg");

        // When
        Map<String, List<String>> months = catalog.listMonthsAndSites();
        List<Photo> photos = catalog.loadGroup(new ReportSelector("ALPHA", "grass_cutting", null, null));

        // Then
        assertEquals(List.of("2024-05", "2024-06"), List.copyOf(months.keySet()));
        assertEquals(4, photos.size());
    }

    @Test
    void shouldFindStoredPhotoById() throws Exception {
        // Given
        String id = "2024-05/ALPHA/grass_cutting/after/alpha_grass_cutting_after_20240503_160000_z_photo.jpg";

        // When
        Photo photo = catalog.findPhoto(id);

        // Then
        assertEquals(id, photo.getId());
        assertEquals(Phase.AFTER, photo.getPhase());
        assertEquals("ALPHA", photo.getSite());
        assertArrayEquals(new byte[]{7}, catalog.readContent(photo));
    }

    @Test
    void shouldNotFindUnknownOrMisplacedPhotos() {
        assertThrows(PhotoNotFoundException.class, () -> catalog.findPhoto("2024-05/ALPHA/grass_cutting/after/missing.jpg"));
        assertThrows(PhotoNotFoundException.class, () -> catalog.findPhoto("../../etc/passwd"));
        assertThrows(PhotoNotFoundException.class, () -> catalog.findPhoto("2024-05/CHARLIE/unknown_task/middle/c.jpg"));
    }

    @Test
    void shouldFallBackToModificationTimeWithoutTimestamp() {
        LocalDateTime fallback = LocalDateTime.parse("2024-05-05T10:00:00");

        assertEquals(fallback, PhotoCatalog.captureTime("IMG_0001.jpg", fallback));
        assertEquals(LocalDateTime.parse("2024-05-03T09:00:00"),
                PhotoCatalog.captureTime("a_b_before_20240503_090000_x.jpg", fallback));
    }

    private void write(String path) throws Exception {
        store.writeNew(Paths.get(path), new byte[]{7});
    }
}
