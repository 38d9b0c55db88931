package secops.threatgraph.core.domain.model;

public enum ChangeKind {
  CREATED,
  UPDATED,
  DELETED
}
