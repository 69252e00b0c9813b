package com.callcenter.backend.agent.capability;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.util.StringUtils;

/** A registered handler: its name, the variant implementing it, declared skills and availability. */
public record Capability(String name, String specialization, Set<String> skills, boolean available) {

  public Capability {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("Capability name must not be blank");
    }
    skills =
        skills == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(skills));
  }

  public boolean hasSkill(String skill) {
    return skill != null && skills.contains(skill);
  }

  public Capability withAvailability(boolean availability) {
    if (availability == available) {
      return this;
    }
    return new Capability(name, specialization, skills, availability);
  }
}
