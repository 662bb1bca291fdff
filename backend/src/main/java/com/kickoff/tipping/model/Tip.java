package com.kickoff.tipping.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "tips", indexes = {
        @Index(name = "idx_tips_user", columnList = "user_id"),
        @Index(name = "idx_tips_fixture", columnList = "fixture_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_tip_user_fixture", columnNames = {"user_id", "fixture_id"})
})
public class Tip {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_tip_user"))
    private AppUser user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "fixture_id", nullable = false, foreignKey = @ForeignKey(name = "fk_tip_fixture"))
    private Fixture fixture;

    @Column(name = "tip_team", nullable = false)
    private String tipTeam;

    // null until the fixture has a result
    @Column(name = "points_awarded")
    private Integer pointsAwarded;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Tip() {}

    public Tip(AppUser user, Fixture fixture, String tipTeam, Instant now) {
        this.user = user;
        this.fixture = fixture;
        this.tipTeam = tipTeam;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public AppUser getUser() { return user; }
    public void setUser(AppUser user) { this.user = user; }

    public Fixture getFixture() { return fixture; }
    public void setFixture(Fixture fixture) { this.fixture = fixture; }

    public String getTipTeam() { return tipTeam; }
    public void setTipTeam(String tipTeam) { this.tipTeam = tipTeam; }

    public Integer getPointsAwarded() { return pointsAwarded; }
    public void setPointsAwarded(Integer pointsAwarded) { this.pointsAwarded = pointsAwarded; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
