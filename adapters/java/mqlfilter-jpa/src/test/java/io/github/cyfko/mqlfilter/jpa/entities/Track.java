package io.github.cyfko.mqlfilter.jpa.entities;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "track")
public class Track {

    @Id
    private Long trackId;

    private String name;

    private String composer;

    private Integer milliseconds;

    @Column(precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "album_id")
    private Album album;

    @ManyToMany(mappedBy = "tracks")
    private Set<Playlist> playlists = new HashSet<>();

    protected Track() {
    }

    public Track(Long trackId, String name, String composer, Integer milliseconds, String unitPrice, Album album) {
        this.trackId = trackId;
        this.name = name;
        this.composer = composer;
        this.milliseconds = milliseconds;
        this.unitPrice = new BigDecimal(unitPrice);
        this.album = album;
    }

    public Long getTrackId() {
        return trackId;
    }

    public String getName() {
        return name;
    }

    public String getComposer() {
        return composer;
    }

    public Integer getMilliseconds() {
        return milliseconds;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public Album getAlbum() {
        return album;
    }

    public Set<Playlist> getPlaylists() {
        return playlists;
    }
}
