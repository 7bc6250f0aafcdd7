package com.codeguard.engine.skill;

/** Common shape of every skill's argument record: the snippet under edit. */
public interface SkillInput {

    String snippet();
}
