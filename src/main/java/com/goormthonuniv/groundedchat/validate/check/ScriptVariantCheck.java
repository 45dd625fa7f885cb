package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.ScriptVariantDetector;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

/** 프로필이 정한 문자 체계와 다르면 재작성만 한 번 (재생성 아님) */
public class ScriptVariantCheck implements GroundingCheck {

    private final ScriptVariantDetector detector;

    public ScriptVariantCheck(ScriptVariantDetector detector) {
        this.detector = detector;
    }

    @Override
    public String name() { return "script_variant"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.requiredLanguage() != null && !ctx.requiredLanguage().isBlank();
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        return !detector.mismatch(text, ctx.requiredLanguage());
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        return generation.rewriteScript(text, ctx.requiredLanguage());
    }
}
