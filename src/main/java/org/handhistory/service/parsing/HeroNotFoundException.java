package org.handhistory.service.parsing;

public class HeroNotFoundException extends HandParseException {

    private final String heroName;

    public HeroNotFoundException(String heroName, int fragmentIndex) {
        super(ParseStage.HERO, "hero '" + heroName + "' is not seated", fragmentIndex, null);
        this.heroName = heroName;
    }

    public String getHeroName() { return heroName; }
}
