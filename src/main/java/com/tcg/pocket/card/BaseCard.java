package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Properties shared by every card definition.
 */
public class BaseCard {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("set_name")
    private String setName;

    @JsonProperty("rarity")
    private String rarity;

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSetName() {
        return setName;
    }

    public String getRarity() {
        return rarity;
    }

    public void setId(String id) {
        this.id = id != null ? id.intern() : null;
    }

    public void setName(String name) {
        // Interned: deck validation and evolution checks compare names constantly
        this.name = name != null ? name.intern() : null;
    }

    public void setSetName(String setName) {
        this.setName = setName;
    }

    public void setRarity(String rarity) {
        this.rarity = rarity;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
