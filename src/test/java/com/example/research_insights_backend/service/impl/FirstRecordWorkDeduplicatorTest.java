package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.model.Work;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FirstRecordWorkDeduplicatorTest {

    private final FirstRecordWorkDeduplicator deduplicator = new FirstRecordWorkDeduplicator();

    private static Work work(String workId, String doi, String title, Integer year) {
        Work work = new Work();
        work.setWorkId(workId);
        work.setDoi(doi);
        work.setTitle(title);
        work.setYear(year);
        return work;
    }

    @Test
    public void testKeepsFirstRecordPerIdentity() {
        Work first = work("W1", "10.1/a", "A", 2020);
        Work sameDoi = work("W9", "https://doi.org/10.1/A", "Other", 2021);
        Work sameId = work("https://openalex.org/W2", null, "B", 2020);
        Work sameIdAgain = work("W2", "", "B again", 2020);
        Work sameSlug = work(null, null, "Title C", 2019);
        Work sameSlugAgain = work(null, null, "Title C!", 2019);

        List<Work> unique = deduplicator.dedupe(Arrays.asList(first, sameDoi, sameId, sameIdAgain, sameSlug, sameSlugAgain));

        assertEquals(3, unique.size());
        assertSame(first, unique.get(0));
        assertSame(sameId, unique.get(1));
        assertSame(sameSlug, unique.get(2));
    }

    @Test
    public void testWorksWithoutIdentityAreKept() {
        List<Work> unique = deduplicator.dedupe(Arrays.asList(work(null, null, null, null), work(null, null, "", null)));

        assertEquals(2, unique.size());
        assertTrue(deduplicator.dedupe(null).isEmpty());
    }
}
