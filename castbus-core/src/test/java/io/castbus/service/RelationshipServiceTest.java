package io.castbus.service;

import io.castbus.dispatch.DefaultEventBus;
import io.castbus.event.CharacterDeleted;
import io.castbus.event.RelationshipError;
import io.castbus.event.RelationshipStrengthened;
import io.castbus.handler.RelationshipChangeHandler;
import io.castbus.model.CharacterType;
import io.castbus.model.Relationship;
import io.castbus.model.RelationshipType;
import io.castbus.model.StoryCharacter;
import io.castbus.store.InMemoryStoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.castbus.event.CharacterEventTypes.CHARACTER_DELETED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_ERROR;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_STRENGTHENED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelationshipServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final double DELTA = 1e-9;

    private DefaultEventBus bus;
    private InMemoryStoryStore store;
    private RelationshipService service;

    @BeforeEach
    void setUp() {
        bus = DefaultEventBus.builder().build();
        store = new InMemoryStoryStore();
        for (String id : List.of("hero", "mentor", "rival")) {
            store.saveCharacter(StoryCharacter.of(id, id, CharacterType.MAIN));
        }
        new RelationshipChangeHandler(store, bus).register();
        service = new RelationshipService(store, store, bus, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    // ── Validation ──────────────────────────────────────────────────

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () ->
                service.updateRelationship("", "mentor", RelationshipType.FRIEND, 0.5));
        assertThrows(IllegalArgumentException.class, () ->
                service.updateRelationship("hero", "hero", RelationshipType.FRIEND, 0.5));
        assertThrows(IllegalArgumentException.class, () ->
                service.updateRelationship("hero", "mentor", RelationshipType.FRIEND, 1.5));
        assertThrows(IllegalArgumentException.class, () ->
                service.updateRelationship("hero", "mentor", RelationshipType.FRIEND, -0.1));
        assertThrows(NullPointerException.class, () ->
                service.updateRelationship("hero", "mentor", null, 0.5));
        assertThrows(IllegalArgumentException.class, () ->
                service.strengthenRelationship("hero", "mentor", -1, "oops"));
    }

    @Test
    void unknownCharacterIsNotFound() {
        NotFoundException ex = assertThrows(NotFoundException.class, () ->
                service.updateRelationship("hero", "ghost", RelationshipType.FRIEND, 0.5));
        assertEquals("Character", ex.entity());
        assertEquals("ghost", ex.id());
    }

    @Test
    void missingRelationshipIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.strengthenRelationship("hero", "mentor", 0.1, "x"));
        assertThrows(NotFoundException.class, () -> service.weakenRelationship("hero", "mentor", 0.1, "x"));
        assertThrows(NotFoundException.class, () -> service.deleteRelationship("hero", "mentor"));
    }

    // ── Mutations through events ────────────────────────────────────

    @Test
    void updateCreatesBothDirections() throws Exception {
        service.updateRelationship("hero", "mentor", RelationshipType.STUDENT, 0.5);
        drain();

        assertEquals(RelationshipType.STUDENT, store.getRelationship("hero", "mentor").orElseThrow().type());
        Relationship reverse = store.getRelationship("mentor", "hero").orElseThrow();
        assertEquals(RelationshipType.MENTOR, reverse.type());
        assertEquals(0.4, reverse.strength(), DELTA);
    }

    @Test
    void updateKeepsHistory() throws Exception {
        service.updateRelationship("hero", "rival", RelationshipType.RIVAL, 0.3);
        drain();
        service.updateRelationship("hero", "rival", RelationshipType.ENEMY, 0.9);
        drain();

        Relationship stored = store.getRelationship("hero", "rival").orElseThrow();
        assertEquals(RelationshipType.ENEMY, stored.type());
        assertEquals(1, stored.history().size());
        assertEquals(NOW, stored.history().get(0).timestamp());
        assertEquals(RelationshipType.RIVAL, stored.history().get(0).previousType());
        assertEquals(0.3, stored.history().get(0).previousStrength(), DELTA);
        assertEquals(RelationshipType.ENEMY, store.getRelationship("rival", "hero").orElseThrow().type());
    }

    @Test
    void updatesIssuedWhileBusIsBusyKeepHistory() throws Exception {
        List<RelationshipStrengthened> strengthened = new CopyOnWriteArrayList<>();
        bus.subscribe(RELATIONSHIP_STRENGTHENED, event -> strengthened.add(event.payload()));
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        bus.subscribe(CHARACTER_DELETED, event -> {
            busy.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        bus.publish(CHARACTER_DELETED, new CharacterDeleted("extra", "Extra"));
        assertTrue(busy.await(5, TimeUnit.SECONDS));

        service.updateRelationship("hero", "mentor", RelationshipType.MENTOR, 0.5);
        service.updateRelationship("hero", "mentor", RelationshipType.MENTOR, 0.8);
        release.countDown();
        drain();

        Relationship stored = store.getRelationship("hero", "mentor").orElseThrow();
        assertEquals(0.8, stored.strength(), DELTA);
        assertEquals(1, stored.history().size());
        assertEquals(0.5, stored.history().get(0).previousStrength(), DELTA);
        assertEquals(1, strengthened.size());
        assertEquals(0.5, strengthened.get(0).previousStrength(), DELTA);
        assertEquals(0.8, strengthened.get(0).newStrength(), DELTA);
    }

    @Test
    void strengthenClampsAtOne() throws Exception {
        service.updateRelationship("hero", "mentor", RelationshipType.FRIEND, 0.9);
        drain();

        double next = service.strengthenRelationship("hero", "mentor", 0.3, "saved a life");
        drain();

        assertEquals(1.0, next, DELTA);
        assertEquals(1.0, store.getRelationship("hero", "mentor").orElseThrow().strength(), DELTA);
    }

    @Test
    void weakenClampsAtZero() throws Exception {
        service.updateRelationship("hero", "mentor", RelationshipType.FRIEND, 0.2);
        drain();

        double next = service.weakenRelationship("hero", "mentor", 0.5, "betrayal");
        drain();

        assertEquals(0.0, next, DELTA);
        assertEquals(0.0, store.getRelationship("hero", "mentor").orElseThrow().strength(), DELTA);
    }

    @Test
    void deleteResetsToNeutralAndDisconnects() throws Exception {
        service.updateRelationship("hero", "mentor", RelationshipType.STUDENT, 0.7);
        service.updateRelationship("rival", "hero", RelationshipType.RIVAL, 0.6);
        drain();
        assertEquals(List.of("mentor", "rival"), sorted(service.getConnectedCharacters("hero")));

        service.deleteRelationship("hero", "mentor");
        drain();

        assertEquals(RelationshipType.NEUTRAL, store.getRelationship("hero", "mentor").orElseThrow().type());
        assertEquals(RelationshipType.NEUTRAL, store.getRelationship("mentor", "hero").orElseThrow().type());
        assertEquals(List.of("rival"), service.getConnectedCharacters("hero"));
    }

    @Test
    void connectedCharactersOfLoneCharacterIsEmpty() {
        assertTrue(service.getConnectedCharacters("hero").isEmpty());
    }

    // publishAsync completes once the bus is idle, cascades included
    private void drain() throws Exception {
        bus.publishAsync(RELATIONSHIP_ERROR, new RelationshipError("-", "-", "probe", "drain"))
                .get(5, TimeUnit.SECONDS);
    }

    private static List<String> sorted(List<String> ids) {
        return ids.stream().sorted().toList();
    }
}
