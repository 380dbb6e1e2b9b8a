/*
 * Where: Cron repository integration tests
 * What: Checks the domain queries the jobs depend on against Postgres
 * Why: Organization scoping and status filters live in SQL, not in the jobs
 */
package com.manageros.cron.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.manageros.cron.AbstractPostgresContainerTest;
import com.manageros.cron.model.ManagerReports;
import com.manageros.cron.model.Organization;
import com.manageros.cron.model.OverdueTask;
import com.manageros.cron.model.PersonSummary;
import com.manageros.cron.support.DomainFixtures;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DomainQueryRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private OrganizationRepository organizationRepository;
  @Autowired private PersonRepository personRepository;
  @Autowired private TaskRepository taskRepository;
  @Autowired private ActivityRepository activityRepository;

  private DomainFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new DomainFixtures(jdbcTemplate);
    fixtures.reset();
    fixtures.organization("org-b", NOW.minusSeconds(10));
    fixtures.organization("org-a", NOW.minusSeconds(20));
    fixtures.person("m-1", "org-a", "Maya", "active", null, "user-m1", null);
    fixtures.person("p-ann", "org-a", "Ann", "active", "m-1", null, LocalDate.of(1990, 3, 4));
    fixtures.person("p-bob", "org-a", "Bob", "inactive", "m-1", "user-bob", null);
    fixtures.person("m-2", "org-a", "Nolan", "active", null, null, null);
    fixtures.person("p-cid", "org-a", "Cid", "active", "m-2", null, LocalDate.of(1991, 3, 5));
    fixtures.person("m-3", "org-b", "Oona", "active", null, "user-m3", null);
    fixtures.person("p-dee", "org-b", "Dee", "active", "m-3", null, LocalDate.of(1992, 3, 6));
  }

  @Test
  void organizationsListInCreationOrder() {
    assertThat(organizationRepository.findAll())
        .extracting(Organization::id)
        .containsExactly("org-a", "org-b");
    assertThat(organizationRepository.existsById("org-a")).isTrue();
    assertThat(organizationRepository.existsById("ghost")).isFalse();
  }

  @Test
  void birthdayManagersNeedLinkedUserAndStayInsideOrganization() {
    final List<ManagerReports> managers = personRepository.findManagersWithBirthdayReports("org-a");

    assertThat(managers).extracting(ManagerReports::managerId).containsExactly("m-1");
    assertThat(managers.get(0).userId()).isEqualTo("user-m1");
    assertThat(managers.get(0).reports()).extracting(PersonSummary::name).containsExactly("Ann");
  }

  @Test
  void activeManagerQuerySkipsInactiveReports() {
    final List<ManagerReports> managers =
        personRepository.findActiveManagersWithActiveReports("org-a");

    assertThat(managers).extracting(ManagerReports::managerId).containsExactly("m-1");
    assertThat(managers.get(0).reports()).extracting(PersonSummary::id).containsExactly("p-ann");
  }

  @Test
  void overdueTasksResolveOrganizationThroughInitiativeOrObjective() {
    fixtures.initiative("i-a", "org-a");
    fixtures.objective("o-a", "i-a");
    fixtures.initiative("i-b", "org-b");
    final Instant yesterday = NOW.minus(Duration.ofDays(1));
    fixtures.task("t-direct", "todo", yesterday, "m-1", "i-a", null, NOW);
    fixtures.task("t-objective", "in_progress", yesterday, "m-1", null, "o-a", NOW);
    fixtures.task("t-done", "done", yesterday, "m-1", "i-a", null, NOW);
    fixtures.task("t-dropped", "dropped", yesterday, "m-1", "i-a", null, NOW);
    fixtures.task("t-future", "todo", NOW.plus(Duration.ofDays(2)), "m-1", "i-a", null, NOW);
    fixtures.task("t-no-user", "todo", yesterday, "p-ann", "i-a", null, NOW);
    fixtures.task("t-other-org", "todo", yesterday, "m-1", "i-b", null, NOW);
    fixtures.task("t-orphan", "todo", yesterday, "m-1", null, null, NOW);

    final List<OverdueTask> overdue = taskRepository.findOverdue("org-a", NOW);

    assertThat(overdue)
        .extracting(OverdueTask::id)
        .containsExactlyInAnyOrder("t-direct", "t-objective");
    assertThat(overdue).allSatisfy(task -> assertThat(task.assigneeUserId()).isEqualTo("user-m1"));
  }

  @Test
  void activitySignalsRespectCutoff() {
    final Instant cutoff = NOW.minus(Duration.ofDays(14));
    fixtures.initiative("i-a", "org-a");
    fixtures.task("t-old", "todo", null, "p-ann", "i-a", null, NOW.minus(Duration.ofDays(30)));
    fixtures.oneOnOne("o-1", "m-1", "p-ann", NOW.minus(Duration.ofDays(3)));
    fixtures.feedback("f-1", "p-cid", NOW.minus(Duration.ofDays(1)));

    assertThat(activityRepository.findLatestTaskActivity("p-ann", cutoff)).isEmpty();
    assertThat(activityRepository.findLatestOneOnOne("p-ann", cutoff))
        .contains(NOW.minus(Duration.ofDays(3)));
    assertThat(activityRepository.findLatestFeedback("p-ann", cutoff)).isEmpty();
    assertThat(activityRepository.findLatestFeedback("p-cid", cutoff))
        .contains(NOW.minus(Duration.ofDays(1)));
  }
}
