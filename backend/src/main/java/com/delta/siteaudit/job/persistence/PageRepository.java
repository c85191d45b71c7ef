package com.delta.siteaudit.job.persistence;

import com.delta.siteaudit.crawl.model.CrawledPage;
import com.delta.siteaudit.job.model.ClaimedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class PageRepository {
    private static final Logger log = LoggerFactory.getLogger(PageRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public PageRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts pages for the claimed run. A page whose URL hash is already stored for the run
     * is skipped, so the stored set never holds duplicates. Returns the number inserted.
     */
    public int insertPages(ClaimedJob claimed, List<CrawledPage> pages) {
        int inserted = 0;
        for (CrawledPage page : pages) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", claimed.jobId())
                .addValue("runNumber", claimed.runNumber())
                .addValue("domain", page.domain())
                .addValue("isTarget", page.target())
                .addValue("url", page.url())
                .addValue("normalizedUrl", page.normalizedUrl())
                .addValue("urlHash", page.urlHash())
                .addValue("title", page.title())
                .addValue("metaDescription", page.metaDescription())
                .addValue("rawContent", page.rawContent())
                .addValue("extractedText", page.extractedText())
                .addValue("wordCount", page.wordCount())
                .addValue("priorityTier", page.priorityTier())
                .addValue("contentHash", page.contentHash())
                .addValue("fetchedAt", Timestamp.from(page.fetchedAt()));
            try {
                inserted += jdbc.update(
                    """
                        INSERT INTO crawled_pages (
                            job_id, run_number, domain, is_target, url, normalized_url, url_hash,
                            title, meta_description, raw_content, extracted_text, word_count,
                            priority_tier, content_hash, fetched_at
                        )
                        VALUES (
                            :jobId, :runNumber, :domain, :isTarget, :url, :normalizedUrl, :urlHash,
                            :title, :metaDescription, :rawContent, :extractedText, :wordCount,
                            :priorityTier, :contentHash, :fetchedAt
                        )
                        """,
                    params
                );
            } catch (DuplicateKeyException e) {
                log.debug("Page {} already stored for job {}", page.normalizedUrl(), claimed.jobId());
            }
        }
        return inserted;
    }

    /** Pages of one run without raw HTML. */
    public List<CrawledPage> findPages(String jobId, int runNumber) {
        return jdbc.query(
            """
                SELECT domain, is_target, url, normalized_url, url_hash, title, meta_description,
                       extracted_text, word_count, priority_tier, content_hash, fetched_at
                FROM crawled_pages
                WHERE job_id = :jobId
                  AND run_number = :runNumber
                ORDER BY id ASC
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("runNumber", runNumber),
            (rs, rowNum) -> new CrawledPage(
                rs.getString("domain"),
                rs.getBoolean("is_target"),
                rs.getString("url"),
                rs.getString("normalized_url"),
                rs.getString("url_hash"),
                rs.getString("title"),
                rs.getString("meta_description"),
                null,
                rs.getString("extracted_text"),
                rs.getInt("word_count"),
                rs.getInt("priority_tier"),
                rs.getString("content_hash"),
                rs.getTimestamp("fetched_at").toInstant()
            )
        );
    }

    public int countPages(String jobId, int runNumber) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM crawled_pages
                WHERE job_id = :jobId
                  AND run_number = :runNumber
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("runNumber", runNumber),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
