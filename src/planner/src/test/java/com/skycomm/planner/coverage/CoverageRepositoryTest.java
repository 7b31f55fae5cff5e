package com.skycomm.planner.coverage;

import static com.skycomm.planner.TestFixtures.rectangle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CoverageRepositoryTest {

  @Mock
  private CoverageDataSource dataSource;

  @Test
  void loadsDatasetOnceAndCachesSampler() {
    when(dataSource.loadFootprints()).thenReturn(Map.of("AOR", List.of(rectangle(-40, -20, -10, 20))));
    CoverageRepository repository = new CoverageRepository(dataSource);

    Optional<CoverageSampler> first = repository.sampler();
    Optional<CoverageSampler> second = repository.sampler();

    assertThat(first).isPresent();
    assertThat(second.get()).isSameAs(first.get());
    verify(dataSource, times(1)).loadFootprints();
  }

  @Test
  void malformedDatasetDegradesToNoCoverage() {
    when(dataSource.loadFootprints()).thenThrow(new CoverageDataException("broken"));
    CoverageRepository repository = new CoverageRepository(dataSource);

    assertThat(repository.sampler()).isEmpty();
    assertThat(repository.sampler()).isEmpty();
    verify(dataSource, times(1)).loadFootprints();
  }

  @Test
  void emptyDatasetDisablesCoverage() {
    when(dataSource.loadFootprints()).thenReturn(Map.of());

    assertThat(new CoverageRepository(dataSource).sampler()).isEmpty();
  }
}
