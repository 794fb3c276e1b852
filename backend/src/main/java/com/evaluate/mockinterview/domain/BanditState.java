package com.evaluate.mockinterview.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-session arm table: one {@link ArmStats} per question type and one per difficulty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BanditState {
    Map<QuestionType, ArmStats> typeArms;
    Map<Difficulty, ArmStats> difficultyArms;

    public static BanditState of(Map<QuestionType, ArmStats> typeArms, Map<Difficulty, ArmStats> difficultyArms) {
        EnumMap<QuestionType, ArmStats> types = new EnumMap<>(QuestionType.class);
        EnumMap<Difficulty, ArmStats> difficulties = new EnumMap<>(Difficulty.class);
        for (QuestionType type : QuestionType.values()) {
            types.put(type, typeArms.getOrDefault(type, ArmStats.of(0, 0)));
        }
        for (Difficulty difficulty : Difficulty.values()) {
            difficulties.put(difficulty, difficultyArms.getOrDefault(difficulty, ArmStats.of(0, 0)));
        }
        return new BanditState(Collections.unmodifiableMap(types), Collections.unmodifiableMap(difficulties));
    }

    public ArmStats typeArm(QuestionType type) {
        return typeArms.get(type);
    }

    public ArmStats difficultyArm(Difficulty difficulty) {
        return difficultyArms.get(difficulty);
    }

    /**
     * Returns a copy with the type arm and the difficulty arm both credited with one success or one failure.
     */
    public BanditState withOutcome(QuestionType type, Difficulty difficulty, boolean success) {
        EnumMap<QuestionType, ArmStats> types = new EnumMap<>(typeArms);
        EnumMap<Difficulty, ArmStats> difficulties = new EnumMap<>(difficultyArms);
        types.put(type, success ? typeArm(type).withSuccess() : typeArm(type).withFailure());
        difficulties.put(difficulty, success
                ? difficultyArm(difficulty).withSuccess()
                : difficultyArm(difficulty).withFailure());
        return new BanditState(Collections.unmodifiableMap(types), Collections.unmodifiableMap(difficulties));
    }
}
