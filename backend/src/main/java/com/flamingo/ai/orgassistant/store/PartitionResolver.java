package com.flamingo.ai.orgassistant.store;

import com.flamingo.ai.orgassistant.domain.UserRole;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Maps role tags to the partitions a chunk is written to and read from. */
@Component
public class PartitionResolver {

  /**
   * Returns the partitions named by the tags, or only {@link UserRole#GENERAL} when no tag names a
   * known role.
   */
  public Set<UserRole> writePartitions(Collection<String> roleTags) {
    Set<UserRole> partitions = EnumSet.noneOf(UserRole.class);
    if (roleTags != null) {
      for (String tag : roleTags) {
        UserRole.fromValue(tag).ifPresent(partitions::add);
      }
    }
    if (partitions.isEmpty()) {
      partitions.add(UserRole.GENERAL);
    }
    return partitions;
  }

  /** The general partition, plus the role's own partition when the role is a known one. */
  public Set<UserRole> readPartitions(String role) {
    Set<UserRole> partitions = EnumSet.of(UserRole.GENERAL);
    Optional<UserRole> resolved = UserRole.fromValue(role);
    resolved.ifPresent(partitions::add);
    return partitions;
  }
}
