package com.gentoro.lawmcp.statute;

import com.gentoro.lawmcp.exception.StructuralException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the flat block sequence of a law page into a chapter → section → article tree plus a flat
 * article list.
 *
 * <p>The blocks are folded left to right into an {@link Accumulator} that carries the chapter and
 * section currently open. A heading closes whatever it outranks: a chapter heading closes the open
 * chapter and section, a section heading closes the open section. Closed groups never receive
 * further articles. Every call starts from a fresh accumulator, so instances are stateless and
 * thread-safe.
 */
public class DocumentStructurer {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(DocumentStructurer.class);

  public LawStructure structure(List<ContentBlock> blocks) {
    return structure(blocks, StructuringOptions.FULL);
  }

  public LawStructure structure(List<ContentBlock> blocks, StructuringOptions options) {
    if (blocks == null) {
      throw new StructuralException("No content blocks to structure");
    }
    StructuringOptions opts = options == null ? StructuringOptions.FULL : options;

    Accumulator acc = new Accumulator(opts);
    for (ContentBlock block : blocks) {
      if (acc.limitReached()) {
        log.debug("Article limit {} reached, ignoring remaining blocks", opts.maxArticles());
        break;
      }
      acc.accept(block);
    }
    LawStructure result = acc.finish();
    log.debug(
        "Structured {} blocks into {} chapters and {} articles ({} rows skipped)",
        blocks.size(),
        result.chapters().size(),
        result.articles().size(),
        acc.skipped);
    return result;
  }

  /** Running (currentChapter, currentSection) context plus everything emitted so far. */
  private static final class Accumulator {
    private final StructuringOptions options;
    private final List<ChapterDraft> chapters = new ArrayList<>();
    private final List<Article> flat = new ArrayList<>();
    private ChapterDraft currentChapter;
    private SectionDraft currentSection;
    private int skipped;

    Accumulator(StructuringOptions options) {
      this.options = options;
    }

    boolean limitReached() {
      return options.maxArticles() > 0 && flat.size() >= options.maxArticles();
    }

    void accept(ContentBlock block) {
      if (block instanceof ContentBlock.ChapterHeading heading) {
        openChapter(heading.title());
        currentSection = null;
      } else if (block instanceof ContentBlock.SectionHeading heading) {
        if (currentChapter == null) {
          openChapter("");
        }
        currentSection = new SectionDraft(nullToEmpty(heading.title()));
        currentChapter.sections.add(currentSection);
      } else if (block instanceof ContentBlock.ArticleRow row) {
        acceptArticle(row);
      }
    }

    private void acceptArticle(ContentBlock.ArticleRow row) {
      if (row.id() == null || row.id().isBlank() || row.lines() == null) {
        skipped++;
        return;
      }

      List<Line> lines = row.lines();
      boolean truncated = false;
      if (options.summaryMode() && lines.size() > 1) {
        lines = lines.subList(0, 1);
        truncated = true;
      }

      Article article =
          new Article(
              row.id().trim(),
              row.displayLabel(),
              lines,
              currentChapter == null ? null : currentChapter.title,
              currentSection == null ? null : currentSection.title,
              truncated);
      flat.add(article);

      if (currentSection != null) {
        currentSection.articles.add(article);
      } else {
        if (currentChapter == null) {
          openChapter("");
        }
        currentChapter.articles.add(article);
      }
    }

    private void openChapter(String title) {
      currentChapter = new ChapterDraft(nullToEmpty(title));
      chapters.add(currentChapter);
    }

    LawStructure finish() {
      List<Chapter> frozen = new ArrayList<>(chapters.size());
      for (ChapterDraft draft : chapters) {
        frozen.add(draft.freeze());
      }
      LawStructure.Meta meta =
          options.limited()
              ? new LawStructure.Meta(flat.size(), options.summaryMode(), options.maxArticles())
              : null;
      return new LawStructure(frozen, flat, meta);
    }

    private static String nullToEmpty(String s) {
      return s == null ? "" : s;
    }
  }

  private static final class ChapterDraft {
    final String title;
    final List<SectionDraft> sections = new ArrayList<>();
    final List<Article> articles = new ArrayList<>();

    ChapterDraft(String title) {
      this.title = title;
    }

    Chapter freeze() {
      List<Section> frozen = new ArrayList<>(sections.size());
      for (SectionDraft s : sections) {
        frozen.add(new Section(s.title, s.articles));
      }
      return new Chapter(title, frozen, articles);
    }
  }

  private static final class SectionDraft {
    final String title;
    final List<Article> articles = new ArrayList<>();

    SectionDraft(String title) {
      this.title = title;
    }
  }
}
