package io.github.cyfko.mqlfilter.jpa;

import io.github.cyfko.mqlfilter.jpa.entities.Album;
import io.github.cyfko.mqlfilter.jpa.entities.Artist;
import io.github.cyfko.mqlfilter.jpa.entities.Employee;
import io.github.cyfko.mqlfilter.jpa.entities.Playlist;
import io.github.cyfko.mqlfilter.jpa.entities.Track;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small excerpt of the Chinook sample database, loaded into H2.
 *
 * <pre>
 * Album 1 "For Those About To Rock We Salute You" (AC/DC)     tracks 1, 6
 * Album 2 "Balls to the Wall" (Accept)                        track 2
 * Album 3 "Restless and Wild" (Accept)                        tracks 3, 4
 * Album 4 "Jagged Little Pill" (Alanis Morissette)            tracks 5, 7
 * Album 5 "Supposed Former Infatuation Junkie" (Alanis Morissette), no track
 *
 * Playlist 1 "Music": tracks 1, 2, 3, 5, 7
 * Playlist 2 "Grunge": track 5
 * Playlist 3 "90's Music": track 7
 * Playlist 4 "Audiobooks": no track
 *
 * Employee 1 Andrew Adams  &lt;- 2 Nancy Edwards &lt;- 3 Jane Peacock
 * </pre>
 */
final class ChinookDatabase {

    private ChinookDatabase() {
    }

    static EntityManagerFactory create() {
        EntityManagerFactory emf = Persistence.createEntityManagerFactory("testPU");
        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();

        Artist acdc = new Artist(1L, "AC/DC");
        Artist accept = new Artist(2L, "Accept");
        Artist alanis = new Artist(3L, "Alanis Morissette");
        List.of(acdc, accept, alanis).forEach(em::persist);

        Album forThoseAboutToRock = new Album(1L, "For Those About To Rock We Salute You", acdc);
        Album ballsToTheWall = new Album(2L, "Balls to the Wall", accept);
        Album restlessAndWild = new Album(3L, "Restless and Wild", accept);
        Album jaggedLittlePill = new Album(4L, "Jagged Little Pill", alanis);
        Album junkie = new Album(5L, "Supposed Former Infatuation Junkie", alanis);
        List.of(forThoseAboutToRock, ballsToTheWall, restlessAndWild, jaggedLittlePill, junkie).forEach(em::persist);

        Track t1 = new Track(1L, "For Those About To Rock (We Salute You)",
                "Angus Young, Malcolm Young, Brian Johnson", 343719, "0.99", forThoseAboutToRock);
        Track t2 = new Track(2L, "Balls to the Wall", null, 342562, "0.99", ballsToTheWall);
        Track t3 = new Track(3L, "Fast As a Shark",
                "F. Baltes, S. Kaufman, U. Dirkscneider & W. Hoffman", 230619, "0.99", restlessAndWild);
        Track t4 = new Track(4L, "Restless and Wild",
                "F. Baltes, R.A. Smith-Diesel, S. Kaufman, U. Dirkscneider & W. Hoffman", 252051, "0.99", restlessAndWild);
        Track t5 = new Track(5L, "All I Really Want", "Alanis Morissette & Glenn Ballard", 284891, "0.99", jaggedLittlePill);
        Track t6 = new Track(6L, "Put The Finger On You",
                "Angus Young, Malcolm Young, Brian Johnson", 205662, "0.99", forThoseAboutToRock);
        Track t7 = new Track(7L, "Hand In My Pocket", "Alanis Morissette & Glenn Ballard", 221570, "1.99", jaggedLittlePill);
        List.of(t1, t2, t3, t4, t5, t6, t7).forEach(em::persist);

        Map<Playlist, List<Track>> playlists = new LinkedHashMap<>();
        playlists.put(new Playlist(1L, "Music"), List.of(t1, t2, t3, t5, t7));
        playlists.put(new Playlist(2L, "Grunge"), List.of(t5));
        playlists.put(new Playlist(3L, "90's Music"), List.of(t7));
        playlists.put(new Playlist(4L, "Audiobooks"), List.of());
        playlists.forEach((playlist, tracks) -> {
            playlist.getTracks().addAll(tracks);
            em.persist(playlist);
        });

        Employee andrew = new Employee(1L, "Andrew", "Adams", true, Employee.Role.GENERAL_MANAGER,
                LocalDateTime.of(1962, 2, 18, 0, 0), LocalDate.of(2002, 8, 14), LocalTime.of(8, 0), null);
        Employee nancy = new Employee(2L, "Nancy", "Edwards", true, Employee.Role.SALES_MANAGER,
                LocalDateTime.of(1958, 12, 8, 0, 0), LocalDate.of(2002, 5, 1), LocalTime.of(9, 0), andrew);
        Employee jane = new Employee(3L, "Jane", "Peacock", false, Employee.Role.SALES_SUPPORT,
                LocalDateTime.of(1973, 8, 29, 0, 0), LocalDate.of(2002, 4, 1), LocalTime.of(13, 30), nancy);
        List.of(andrew, nancy, jane).forEach(em::persist);

        em.getTransaction().commit();
        em.close();
        return emf;
    }

    static Map<String, Object> doc(Object... keyValues) {
        Map<String, Object> document = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            document.put((String) keyValues[i], keyValues[i + 1]);
        }
        return document;
    }
}
