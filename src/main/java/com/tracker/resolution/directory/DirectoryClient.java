package com.tracker.resolution.directory;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.CustomFieldDefinition;
import com.tracker.resolution.core.model.CustomFieldDefinitionFull;
import com.tracker.resolution.core.model.IssueQuery;
import com.tracker.resolution.core.model.IssueRecord;
import com.tracker.resolution.core.model.IssueStatus;
import com.tracker.resolution.core.model.Membership;
import com.tracker.resolution.core.model.Project;
import com.tracker.resolution.exception.UpstreamException;

import java.util.List;

/**
 * Read-only data source backing resolution and workflow mining. Implemented by
 * the REST client of the tracking backend.
 *
 * <p>All methods are blocking. Any transport or HTTP failure surfaces as
 * {@link UpstreamException}; timeouts are the implementation's concern.</p>
 */
public interface DirectoryClient {

    List<Project> listProjects(int limit);

    List<Candidate> listTrackers();

    List<IssueStatus> listStatuses();

    List<Candidate> listPriorities();

    List<Candidate> listActivities();

    List<Membership> listProjectMemberships(int projectId, int limit);

    /**
     * Returns the user the client is authenticated as.
     */
    Candidate currentUser();

    /**
     * Derives field definitions from one sample issue in the given scope.
     * Works without privileges.
     *
     * @param projectId project scope
     * @param trackerId tracker scope, 0 for any tracker
     * @throws UpstreamException if the request fails or the scope has no issues
     */
    List<CustomFieldDefinition> sampleCustomFields(int projectId, int trackerId);

    /**
     * Lists every custom field definition. Requires administrator privileges.
     *
     * @throws UpstreamException if the request fails or the caller lacks privileges
     */
    List<CustomFieldDefinitionFull> listAllCustomFields();

    List<IssueRecord> searchIssues(IssueQuery query);

    /**
     * Fetches one issue including its journals.
     */
    IssueRecord getIssue(int issueId);
}
