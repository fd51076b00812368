package com.tcg.pocket.game;

import java.util.Objects;

/**
 * Bookkeeping of the attack currently resolving.
 */
public class AttackContext {
    private final int attacker;
    private final int attackerInstanceId;
    private final int attackIndex;
    private int damage;
    private int damageDealt;
    private int defenderInstanceId = -1;

    public AttackContext(int attacker, int attackerInstanceId, int attackIndex, int baseDamage) {
        this.attacker = attacker;
        this.attackerInstanceId = attackerInstanceId;
        this.attackIndex = attackIndex;
        this.damage = baseDamage;
    }

    public AttackContext copy() {
        AttackContext copy = new AttackContext(attacker, attackerInstanceId, attackIndex, damage);
        copy.damageDealt = damageDealt;
        copy.defenderInstanceId = defenderInstanceId;
        return copy;
    }

    public int getAttacker() {
        return attacker;
    }

    public int getAttackerInstanceId() {
        return attackerInstanceId;
    }

    public int getAttackIndex() {
        return attackIndex;
    }

    public int getDamage() {
        return damage;
    }

    public void addDamage(int amount) {
        damage = Math.max(0, damage + amount);
    }

    public void setDamage(int damage) {
        this.damage = Math.max(0, damage);
    }

    public int getDamageDealt() {
        return damageDealt;
    }

    public int getDefenderInstanceId() {
        return defenderInstanceId;
    }

    public void recordHit(int defenderInstanceId, int dealt) {
        this.defenderInstanceId = defenderInstanceId;
        this.damageDealt = dealt;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttackContext other
            && attacker == other.attacker
            && attackerInstanceId == other.attackerInstanceId
            && attackIndex == other.attackIndex
            && damage == other.damage
            && damageDealt == other.damageDealt
            && defenderInstanceId == other.defenderInstanceId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(attacker, attackerInstanceId, attackIndex, damage, damageDealt, defenderInstanceId);
    }
}
