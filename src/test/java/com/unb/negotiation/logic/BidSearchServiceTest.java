package com.unb.negotiation.logic;

import com.unb.negotiation.TestFixtures;
import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.BidSpace;
import com.unb.negotiation.model.Domain;
import com.unb.negotiation.model.LinearAdditiveUtilitySpace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BidSearchServiceTest {

    private Domain domain;
    private LinearAdditiveUtilitySpace profile;

    // utility (1 + 0.5 + 0) / 3 = 0.5
    private final Bid halfUtilityBid = TestFixtures.bid("price", "low", "delivery", "normal", "warranty", "5");
    // utility 1
    private final Bid bestBid = TestFixtures.bid("price", "low", "delivery", "fast", "warranty", "0");

    @BeforeEach
    public void setUp() {
        domain = TestFixtures.sixtyBids();
        profile = TestFixtures.preferFirstValues(domain);
    }

    @Test
    void testFindBid_WithoutOpponentBid() {
        BidSearchService search = new BidSearchService(profile, new Random(1));
        for (int i = 0; i < 50; i++) {
            assertTrue(domain.isComplete(search.findBid(null)));
        }
    }

    @Test
    void testFindBid_AlwaysInDomainForAnySampleSize() {
        Random random = new Random(2);
        for (int k : new int[]{1, 2, 10, 59, 60, 61, 500}) {
            BidSearchService search = new BidSearchService(profile, k, BidSearchService.DEFAULT_CONCESSION_MARGIN, random);
            assertTrue(domain.isComplete(search.findBid(null)), "K=" + k);
            assertTrue(domain.isComplete(search.findBid(halfUtilityBid)), "K=" + k);
            assertTrue(domain.isComplete(search.findBid(bestBid)), "K=" + k);
        }
    }

    @Test
    void testFindBid_LargeDomain() {
        Domain large = TestFixtures.large();
        BidSearchService search = new BidSearchService(TestFixtures.preferFirstValues(large), new Random(3));
        Bid opponent = new BidSpace(large).get(123456);
        assertTrue(large.isComplete(search.findBid(opponent)));
        assertTrue(large.isComplete(search.findBid(null)));
    }

    @Test
    void testConcessionThreshold_DefaultMarginIsLoose() {
        BidSearchService search = new BidSearchService(profile, new Random());
        assertEquals(0.5, profile.getUtility(halfUtilityBid), 1e-9);
        assertEquals(-0.4, search.concessionThreshold(profile.getUtility(halfUtilityBid)), 1e-9);
    }

    @Test
    void testFindBid_DefaultMarginBehavesLikeUnfilteredChoice() {
        // the threshold is -0.4, every bid passes, so the filtered path draws exactly like the unfiltered one
        BidSearchService filtered = new BidSearchService(profile, 20, 0.9, new Random(99));
        BidSearchService unfiltered = new BidSearchService(profile, 20, 0.9, new Random(99));
        for (int i = 0; i < 30; i++) {
            assertEquals(unfiltered.findBid(null), filtered.findBid(halfUtilityBid));
        }
    }

    @Test
    void testFindBid_DefaultMarginReachesLowUtilityBids() {
        BidSearchService search = new BidSearchService(profile, new Random(4));
        Set<Bid> offered = new HashSet<>();
        double lowest = 1.0;
        for (int i = 0; i < 400; i++) {
            Bid bid = search.findBid(bestBid);
            offered.add(bid);
            lowest = Math.min(lowest, profile.getUtility(bid));
        }
        // even against the best possible opponent bid almost nothing is filtered out
        assertTrue(offered.size() > 50, "only " + offered.size() + " distinct bids");
        assertTrue(lowest < 0.2, "lowest utility offered " + lowest);
    }

    @Test
    void testFindBid_TightMarginFiltersSample() {
        BidSearchService search = new BidSearchService(profile, 500, 0.1, new Random(6));
        for (int i = 0; i < 100; i++) {
            Bid bid = search.findBid(halfUtilityBid);
            assertTrue(profile.getUtility(bid) > 0.4, "utility " + profile.getUtility(bid));
        }
    }

    @Test
    void testFindBid_EmptyFilterFallsBackToWholeSpace() {
        // threshold 1.5 cannot be met by any bid
        BidSearchService search = new BidSearchService(profile, 5, -0.5, new Random(8));
        Set<Bid> offered = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            Bid bid = search.findBid(bestBid);
            assertTrue(domain.isComplete(bid));
            offered.add(bid);
        }
        assertTrue(offered.size() > 5, "fallback should not be limited to the sample");
    }

    @Test
    void testConstructor_RejectsEmptySample() {
        assertThrows(IllegalArgumentException.class, () -> new BidSearchService(profile, 0, 0.9, new Random()));
    }
}
