package uk.gegc.fluency.features.sync.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import uk.gegc.fluency.BaseUnitTest;
import uk.gegc.fluency.features.sync.api.dto.VersionCheck;
import uk.gegc.fluency.features.sync.domain.model.CompletionStatus;
import uk.gegc.fluency.features.writing.api.dto.WritingQuestionDetail;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestion;
import uk.gegc.fluency.features.writing.domain.model.WritingQuestionType;
import uk.gegc.fluency.features.writing.infra.sync.WritingQuestionCompletionEvaluator;
import uk.gegc.fluency.testsupport.WritingDetails;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("DeltaSyncResolver")
class DeltaSyncResolverTest extends BaseUnitTest {

    @Mock
    private JpaSpecificationExecutor<WritingQuestion> repository;

    @Mock
    private DetailAssembler<WritingQuestion, WritingQuestionDetail> assembler;

    @Mock
    private DetailCacheSynchronizer<WritingQuestionDetail> cacheSynchronizer;

    private DeltaSyncResolver<WritingQuestion, WritingQuestionDetail> resolver;

    @BeforeEach
    void setUp() {
        resolver = new DeltaSyncResolver<>(repository, assembler, new WritingQuestionCompletionEvaluator(),
                cacheSynchronizer);
    }

    @Test
    @DisplayName("empty or null input returns an empty list without querying")
    void resolve_emptyInput() {
        assertThat(resolver.resolve(List.of())).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();

        verifyNoInteractions(repository, assembler, cacheSynchronizer);
    }

    @Test
    @DisplayName("newer items come back newest first, from cache when present")
    @SuppressWarnings("unchecked")
    void resolve_usesCacheAtCurrentVersion() {
        WritingQuestion newest = question(3);
        WritingQuestion older = question(2);
        WritingQuestionDetail cachedNewest = WritingDetails.essay(newest.getId(), 3, List.of());
        WritingQuestionDetail assembledOlder = WritingDetails.essay(older.getId(), 2, List.of(WritingDetails.essayRecord()));

        when(repository.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of(newest, older));
        when(cacheSynchronizer.fetch(newest.getId(), 3)).thenReturn(Optional.of(cachedNewest));
        when(cacheSynchronizer.fetch(older.getId(), 2)).thenReturn(Optional.empty());
        when(assembler.assemble(older)).thenReturn(assembledOlder);

        List<WritingQuestionDetail> result = resolver.resolve(List.of(
                new VersionCheck(newest.getId(), 1),
                new VersionCheck(older.getId(), 1)));

        assertThat(result).containsExactly(cachedNewest, assembledOlder);
        verify(assembler, never()).assemble(newest);
        verify(cacheSynchronizer).fill(assembledOlder, CompletionStatus.COMPLETE);

        ArgumentCaptor<Sort> sort = ArgumentCaptor.forClass(Sort.class);
        verify(repository).findAll(any(Specification.class), sort.capture());
        assertThat(sort.getValue().getOrderFor("createdAt")).isNotNull();
        assertThat(sort.getValue().getOrderFor("createdAt").isDescending()).isTrue();
    }

    @Test
    @DisplayName("when an id is sent twice the last version wins")
    void knownVersions_lastPairWins() {
        UUID repeated = UUID.randomUUID();
        UUID other = UUID.randomUUID();

        Map<UUID, Integer> known = DeltaSyncResolver.knownVersions(List.of(
                new VersionCheck(repeated, 5),
                new VersionCheck(other, 2),
                new VersionCheck(repeated, 1)));

        assertThat(known).containsExactly(entry(repeated, 1), entry(other, 2));
    }

    @Test
    @DisplayName("no newer items gives an empty result")
    @SuppressWarnings("unchecked")
    void resolve_nothingNewer() {
        when(repository.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of());

        assertThat(resolver.resolve(List.of(new VersionCheck(UUID.randomUUID(), 5)))).isEmpty();
        verifyNoInteractions(assembler, cacheSynchronizer);
    }

    @Test
    @DisplayName("a cache miss assembles, evaluates and primes the cache")
    void readThrough_miss() {
        WritingQuestion item = question(1);
        WritingQuestionDetail detail = WritingDetails.essay(item.getId(), 1, List.of());
        when(cacheSynchronizer.fetch(item.getId(), 1)).thenReturn(Optional.empty());
        when(assembler.assemble(item)).thenReturn(detail);

        assertThat(resolver.readThrough(item)).isEqualTo(detail);
        verify(cacheSynchronizer).fill(detail, CompletionStatus.UNCOMPLETE);
    }

    @Test
    @DisplayName("list read keeps the caller's order, drops duplicates and unknown ids")
    @SuppressWarnings("unchecked")
    void readThrough_list() {
        WritingQuestion a = question(1);
        WritingQuestion b = question(4);
        WritingQuestionDetail detailA = WritingDetails.essay(a.getId(), 1, List.of());
        WritingQuestionDetail detailB = WritingDetails.essay(b.getId(), 4, List.of());
        when(repository.findAll(any(Specification.class))).thenReturn(List.of(a, b));
        when(cacheSynchronizer.fetch(a.getId(), 1)).thenReturn(Optional.of(detailA));
        when(cacheSynchronizer.fetch(b.getId(), 4)).thenReturn(Optional.of(detailB));

        List<WritingQuestionDetail> result = resolver.readThrough(List.of(b.getId(), UUID.randomUUID(), a.getId(), b.getId()));

        assertThat(result).containsExactly(detailB, detailA);
        verifyNoInteractions(assembler);
    }

    private static WritingQuestion question(int version) {
        WritingQuestion question = new WritingQuestion();
        question.setId(UUID.randomUUID());
        question.setType(WritingQuestionType.ESSAY);
        question.setVersion(version);
        return question;
    }
}
