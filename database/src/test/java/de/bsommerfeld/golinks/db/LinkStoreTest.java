package de.bsommerfeld.golinks.db;

import de.bsommerfeld.golinks.core.domain.ClickEvent;
import de.bsommerfeld.golinks.core.domain.Link;
import de.bsommerfeld.golinks.core.domain.LinkOwner;
import de.bsommerfeld.golinks.core.domain.LinkShare;
import de.bsommerfeld.golinks.core.domain.Role;
import de.bsommerfeld.golinks.core.domain.Tag;
import de.bsommerfeld.golinks.core.domain.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for LinkStore against a migrated temporary SQLite
 * database.
 */
class LinkStoreTest {

    @TempDir
    Path tempDir;

    private Database db;
    private MutableClock clock;
    private LinkStore links;
    private TagStore tags;
    private OwnershipStore ownership;
    private String alice;
    private String bob;

    @BeforeEach
    void setUp() {
        db = TestDatabases.migrated(tempDir);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        tags = new TagStore(db);
        links = new LinkStore(db, tags, clock);
        ownership = new OwnershipStore(db);
        UserStore users = new UserStore(db);
        alice = users.upsert("github", "alice", "alice@example.com", "Alice", Role.USER).id();
        bob = users.upsert("github", "bob", "bob@example.com", "Bob", Role.USER).id();
    }

    // -- Create --

    @Test
    void create_shouldPersistLinkWithPrimaryOwner() {
        Link link = links.create("Wiki", " https://wiki.example.com ", "Wiki", "Team wiki", alice);

        assertNotNull(link.id());
        assertEquals("wiki", link.slug());
        assertEquals("https://wiki.example.com", link.url());
        assertEquals("Wiki", link.title());
        assertEquals("Team wiki", link.description());
        assertEquals(clock.instant(), link.createdAt());
        assertEquals(link.createdAt(), link.updatedAt());
        assertEquals(List.of(new LinkOwner(alice, true)), link.owners());
        assertTrue(link.tags().isEmpty());
    }

    @Test
    void create_shouldStoreMissingTitleAndDescriptionAsEmpty() {
        Link link = links.create("docs", "https://docs.example.com", null, null, alice);

        assertEquals("", link.title());
        assertEquals("", link.description());
    }

    @Test
    void create_shouldAllowEachSlugOnlyOnceInAnyCase() {
        links.create("wiki", "https://a.example.com", "", "", alice);

        for (String variant : List.of("wiki", "WIKI", " Wiki ")) {
            StoreException ex = assertThrows(StoreException.class,
                    () -> links.create(variant, "https://b.example.com", "", "", bob));
            assertEquals(StoreException.Kind.SLUG_TAKEN, ex.getKind());
        }
        assertEquals(1, links.countAll());
        assertEquals("https://a.example.com", links.getBySlug("wiki").url());
    }

    @Test
    void create_shouldRejectInvalidSlugs() {
        for (String slug : List.of("", "-wiki", "wiki-", "has space", "admin", "auth")) {
            StoreException ex = assertThrows(StoreException.class,
                    () -> links.create(slug, "https://example.com", "", "", alice));
            assertEquals(StoreException.Kind.VALIDATION, ex.getKind(), "slug '" + slug + "'");
        }
        assertEquals(0, links.countAll());
    }

    @Test
    void create_shouldRejectBlankUrl() {
        StoreException ex = assertThrows(StoreException.class, () -> links.create("wiki", " ", "", "", alice));
        assertEquals(StoreException.Kind.VALIDATION, ex.getKind());
    }

    @Test
    void create_shouldRollBackWhenOwnerIsUnknown() {
        StoreException ex = assertThrows(StoreException.class,
                () -> links.create("wiki", "https://example.com", "", "", "no-such-user"));

        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
        assertEquals(0, links.countAll());
        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.getBySlug("wiki")).getKind());
    }

    @Test
    void create_shouldDefaultToPublicAndAcceptExplicitVisibility() {
        assertEquals(Visibility.PUBLIC, links.create("wiki", "https://example.com", "", "", alice).visibility());

        Link secret = links.create("hr", "https://hr.example.com", "", "", Visibility.SECURE, alice);

        assertEquals(Visibility.SECURE, secret.visibility());
        assertEquals(Visibility.SECURE, links.getBySlug("hr").visibility());
    }

    @Test
    void create_shouldSucceedForConcurrentWritersOnDistinctSlugs() throws Exception {
        int writers = 16;
        int linksPerWriter = 5;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < linksPerWriter; i++) {
                        String slug = "s" + writer + "-" + i;
                        Link link = links.create(slug, "https://example.com/" + slug, "", "", alice);
                        links.setTags(link.id(), List.of("go", "java"));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures)
                future.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers * linksPerWriter, links.countAll());
        assertEquals(writers * linksPerWriter, links.listByTag("java").size());
        assertEquals(2, tags.list().size());
    }

    // -- Read --

    @Test
    void getBySlug_shouldIgnoreCase() {
        Link created = links.create("wiki", "https://example.com", "", "", alice);

        assertEquals(created.id(), links.getBySlug("WiKi").id());
    }

    @Test
    void getById_shouldReportUnknownLink() {
        StoreException ex = assertThrows(StoreException.class, () -> links.getById("missing"));
        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
    }

    @Test
    void listByOwner_shouldIncludeCoOwnedLinksMostRecentlyUpdatedFirst() {
        Link a = links.create("a", "https://a.example.com", "", "", alice);
        clock.advance(Duration.ofSeconds(1));
        links.create("b", "https://b.example.com", "", "", alice);
        clock.advance(Duration.ofSeconds(1));
        Link c = links.create("c", "https://c.example.com", "", "", bob);
        links.addOwner(c.id(), alice);
        clock.advance(Duration.ofSeconds(1));
        links.update(a.id(), "https://a2.example.com", "", "");

        List<String> slugs = links.listByOwner(alice).stream().map(Link::slug).toList();
        assertEquals(List.of("a", "c", "b"), slugs);
        assertEquals(List.of("c"), links.listByOwner(bob).stream().map(Link::slug).toList());
    }

    @Test
    void listByOwner_shouldReturnFullOwnerSets() {
        Link c = links.create("c", "https://c.example.com", "", "", bob);
        links.addOwner(c.id(), alice);

        Link listed = links.listByOwner(alice).get(0);
        assertEquals(List.of(new LinkOwner(bob, true), new LinkOwner(alice, false)), listed.owners());
    }

    @Test
    void listAll_shouldReturnNewestFirst() {
        links.create("old", "https://old.example.com", "", "", alice);
        clock.advance(Duration.ofMinutes(1));
        links.create("new", "https://new.example.com", "", "", bob);

        assertEquals(List.of("new", "old"), links.listAll().stream().map(Link::slug).toList());
    }

    @Test
    void listByOwnerAndTag_shouldRequireBothOwnershipAndTag() {
        Link wiki = links.create("wiki", "https://example.com", "", "", alice);
        Link docs = links.create("docs", "https://docs.example.com", "", "", bob);
        Link misc = links.create("misc", "https://misc.example.com", "", "", alice);
        links.setTags(wiki.id(), List.of("Go"));
        links.setTags(docs.id(), List.of("Go"));
        links.setTags(misc.id(), List.of("Java"));
        links.addOwner(docs.id(), alice);

        assertEquals(List.of("docs", "wiki"),
                links.listByOwnerAndTag(alice, "go").stream().map(Link::slug).sorted().toList());
        assertEquals(List.of("docs"), links.listByOwnerAndTag(bob, "go").stream().map(Link::slug).toList());
        assertTrue(links.listByOwnerAndTag(bob, "java").isEmpty());
    }

    // -- Update / Delete --

    @Test
    void update_shouldRefreshFieldsButKeepSlug() {
        Link created = links.create("wiki", "https://old.example.com", "Old", "", alice);
        clock.advance(Duration.ofHours(1));

        Link updated = links.update(created.id(), "https://new.example.com", "New", "desc");

        assertEquals("wiki", updated.slug());
        assertEquals("https://new.example.com", updated.url());
        assertEquals("New", updated.title());
        assertEquals("desc", updated.description());
        assertEquals(created.createdAt(), updated.createdAt());
        assertEquals(clock.instant(), updated.updatedAt());
    }

    @Test
    void update_shouldReportUnknownLink() {
        StoreException ex = assertThrows(StoreException.class,
                () -> links.update("missing", "https://example.com", "", ""));
        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
    }

    @Test
    void delete_shouldCascadeOwnersTagsAndClicks() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        links.addOwner(link.id(), bob);
        links.setTags(link.id(), List.of("Docs"));
        SqlClickStore clicks = new SqlClickStore(db);
        clicks.recordClick(ClickEvent.now(link.id(), alice, "hash", "ua", ""));

        links.delete(link.id());

        assertTrue(ownership.listOwners(link.id()).isEmpty());
        assertTrue(tags.listWithCounts().isEmpty());
        assertEquals(0, clicks.getClickStats(link.id()).total());
        assertEquals(0, links.countAll());
    }

    @Test
    void delete_secondCallShouldReportNotFound() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        links.create("docs", "https://docs.example.com", "", "", alice);
        links.delete(link.id());

        StoreException ex = assertThrows(StoreException.class, () -> links.delete(link.id()));
        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
        assertEquals(1, links.countAll());
    }

    @Test
    void update_shouldKeepVisibilityUnlessGiven() {
        Link link = links.create("wiki", "https://example.com", "", "", Visibility.PRIVATE, alice);

        assertEquals(Visibility.PRIVATE, links.update(link.id(), "https://new.example.com", "", "").visibility());
        assertEquals(Visibility.SECURE,
                links.update(link.id(), "https://new.example.com", "", "", Visibility.SECURE).visibility());
    }

    @Test
    void updateVisibility_shouldTouchUpdatedAt() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        clock.advance(Duration.ofMinutes(5));

        Link updated = links.updateVisibility(link.id(), Visibility.SECURE);

        assertEquals(Visibility.SECURE, updated.visibility());
        assertEquals(clock.instant(), updated.updatedAt());
        StoreException ex = assertThrows(StoreException.class,
                () -> links.updateVisibility("missing", Visibility.PUBLIC));
        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
    }

    // -- Shares --

    @Test
    void addShare_shouldBeIdempotent() {
        Link link = links.create("hr", "https://hr.example.com", "", "", Visibility.SECURE, alice);

        assertTrue(links.addShare(link.id(), bob, alice));
        assertFalse(links.addShare(link.id(), bob, alice));

        assertTrue(links.hasShare(link.id(), bob));
        assertFalse(links.hasShare(link.id(), alice));
        List<LinkShare> shares = links.listShares(link.id());
        assertEquals(1, shares.size());
        assertEquals(new LinkShare(link.id(), bob, alice, clock.instant()), shares.get(0));
    }

    @Test
    void addShare_shouldReportUnknownLinkOrUser() {
        Link link = links.create("hr", "https://hr.example.com", "", "", alice);

        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.addShare("missing", bob, alice)).getKind());
        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.addShare(link.id(), "ghost", alice)).getKind());
        assertTrue(links.listShares(link.id()).isEmpty());
    }

    @Test
    void removeShare_shouldReportWhetherAShareExisted() {
        Link link = links.create("hr", "https://hr.example.com", "", "", alice);
        links.addShare(link.id(), bob, alice);

        assertTrue(links.removeShare(link.id(), bob));
        assertFalse(links.removeShare(link.id(), bob));
        assertFalse(links.hasShare(link.id(), bob));
    }

    @Test
    void listByOwnerOrShared_shouldCombineOwnedAndSharedLinksOnce() {
        Link own = links.create("bobs", "https://bob.example.com", "", "", bob);
        Link shared = links.create("hr", "https://hr.example.com", "", "", Visibility.SECURE, alice);
        Link both = links.create("both", "https://both.example.com", "", "", alice);
        links.create("other", "https://other.example.com", "", "", alice);
        links.addShare(shared.id(), bob, alice);
        links.addOwner(both.id(), bob);
        links.addShare(both.id(), bob, alice);

        assertEquals(List.of("bobs", "both", "hr"),
                links.listByOwnerOrShared(bob).stream().map(Link::slug).toList());
        assertEquals(List.of("both", "hr"), links.listSharedWithUser(bob).stream().map(Link::slug).toList());
        assertEquals(own.id(), links.listByOwnerOrShared(bob).get(0).id());
    }

    @Test
    void delete_shouldCascadeShares() {
        Link link = links.create("hr", "https://hr.example.com", "", "", alice);
        links.addShare(link.id(), bob, alice);

        links.delete(link.id());

        assertTrue(links.listSharedWithUser(bob).isEmpty());
        assertTrue(links.listShares(link.id()).isEmpty());
    }

    // -- Ownership --

    @Test
    void addOwner_shouldRejectDuplicates() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        links.addOwner(link.id(), bob);

        assertEquals(StoreException.Kind.DUPLICATE_OWNER,
                assertThrows(StoreException.class, () -> links.addOwner(link.id(), bob)).getKind());
        assertEquals(StoreException.Kind.DUPLICATE_OWNER,
                assertThrows(StoreException.class, () -> links.addOwner(link.id(), alice)).getKind());
        assertEquals(2, links.getById(link.id()).owners().size());
    }

    @Test
    void addOwner_shouldReportUnknownLinkOrUser() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);

        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.addOwner("missing", bob)).getKind());
        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.addOwner(link.id(), "missing")).getKind());
    }

    @Test
    void removeOwner_shouldNeverRemovePrimaryOwner() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);

        StoreException ex = assertThrows(StoreException.class, () -> links.removeOwner(link.id(), alice));
        assertEquals(StoreException.Kind.PRIMARY_OWNER_IMMUTABLE, ex.getKind());
        assertEquals(List.of(new LinkOwner(alice, true)), links.getById(link.id()).owners());
    }

    @Test
    void addThenRemoveOwner_shouldRestoreOwnerSet() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        List<LinkOwner> before = links.getById(link.id()).owners();

        links.addOwner(link.id(), bob);
        assertTrue(ownership.isOwner(link.id(), bob));
        links.removeOwner(link.id(), bob);

        assertEquals(before, links.getById(link.id()).owners());
        assertEquals(StoreException.Kind.NOT_FOUND,
                assertThrows(StoreException.class, () -> links.removeOwner(link.id(), bob)).getKind());
    }

    // -- Tags --

    @Test
    void setTags_shouldMergeBySlugAndSkipBlankNames() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);

        List<Tag> result = links.setTags(link.id(), List.of("Go", "go", "  ", "!!!", "Engineering Tools"));

        assertEquals(List.of("engineering-tools", "go"), result.stream().map(Tag::slug).toList());
        assertEquals("Go", result.get(1).name());
        assertEquals(result, links.listTags(link.id()));
        assertEquals(result, links.getById(link.id()).tags());
    }

    @Test
    void setTags_shouldBeIdempotent() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        List<Tag> first = links.setTags(link.id(), List.of("Go", "Docs"));
        List<Tag> second = links.setTags(link.id(), List.of("Go", "Docs"));

        assertEquals(first, second);
        assertEquals(2, tags.list().size());
    }

    @Test
    void setTags_shouldRemoveDeselectedTagsButKeepTagRows() {
        Link link = links.create("wiki", "https://example.com", "", "", alice);
        links.setTags(link.id(), List.of("Go", "Docs"));

        List<Tag> result = links.setTags(link.id(), List.of("Go"));

        assertEquals(List.of("go"), result.stream().map(Tag::slug).toList());
        assertEquals(2, tags.list().size());
        assertTrue(links.setTags(link.id(), List.of()).isEmpty());
    }

    @Test
    void setTags_shouldReportUnknownLink() {
        StoreException ex = assertThrows(StoreException.class, () -> links.setTags("missing", List.of("Go")));
        assertEquals(StoreException.Kind.NOT_FOUND, ex.getKind());
        assertTrue(tags.list().isEmpty(), "Tag upserts should roll back with the transaction");
    }

    @Test
    void listByTag_shouldReturnTaggedLinks() {
        Link wiki = links.create("wiki", "https://example.com", "", "", alice);
        Link docs = links.create("docs", "https://docs.example.com", "", "", alice);
        links.create("misc", "https://misc.example.com", "", "", alice);
        links.setTags(wiki.id(), List.of("Internal"));
        links.setTags(docs.id(), List.of("internal", "Public"));

        assertEquals(List.of("docs", "wiki"), links.listByTag("internal").stream().map(Link::slug).toList());
        assertEquals(List.of("docs"), links.listByTag("public").stream().map(Link::slug).toList());
        assertTrue(links.listByTag("none").isEmpty());
    }
}
